package uk.gegc.accounting.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.accounting.features.account.domain.model.AccountRole;

import java.time.LocalDateTime;

@Schema(name = "UserAccountDto", description = "Local mirror of an authenticated user")
public record UserAccountDto(
        @Schema(description = "External subject id", example = "5f1c2a7e-0c1b-4d1a-9a55-3f3e3c2d9b10")
        String userId,
        @Schema(description = "Username", example = "jdoe")
        String username,
        @Schema(description = "Email", example = "jdoe@example.com")
        String email,
        @Schema(description = "Role", example = "ENDUSER")
        AccountRole role,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
