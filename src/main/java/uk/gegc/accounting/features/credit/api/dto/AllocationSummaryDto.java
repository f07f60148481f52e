package uk.gegc.accounting.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "AllocationSummaryDto", description = "An allocation that currently counts towards the balance")
public record AllocationSummaryDto(
        UUID id,
        long remainingCredits,
        long totalCredits,
        @Schema(description = "Expiry time, null when the allocation never expires")
        LocalDateTime expiresAt,
        String allocatedBy
) {}
