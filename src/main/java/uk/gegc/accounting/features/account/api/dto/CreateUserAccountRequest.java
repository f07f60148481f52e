package uk.gegc.accounting.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.accounting.features.account.domain.model.AccountRole;

@Schema(name = "CreateUserAccountRequest", description = "Provision a mirror account ahead of the user's first login")
public record CreateUserAccountRequest(
        @Schema(description = "External subject id issued by the identity provider", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "User id is required")
        @Size(max = 64, message = "User id must be at most 64 characters")
        String userId,

        @Schema(description = "Username", example = "jdoe", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Username is required")
        @Size(max = 100, message = "Username must be at most 100 characters")
        String username,

        @Schema(description = "Email", example = "jdoe@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Email is required")
        @Email(message = "Email must be valid")
        String email,

        @Schema(description = "Role", example = "ENDUSER", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Role is required")
        AccountRole role
) {}
