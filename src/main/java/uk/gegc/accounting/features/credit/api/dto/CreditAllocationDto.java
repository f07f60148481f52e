package uk.gegc.accounting.features.credit.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record CreditAllocationDto(
        UUID id,
        String userId,
        long totalCredits,
        long remainingCredits,
        String allocatedBy,
        LocalDateTime createdAt,
        LocalDateTime expiresAt,
        String notes
) {}
