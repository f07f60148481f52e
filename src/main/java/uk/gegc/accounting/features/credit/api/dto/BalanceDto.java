package uk.gegc.accounting.features.credit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "BalanceDto", description = "Spendable credits: the sum of remaining credits over unexpired allocations")
public record BalanceDto(
        String userId,
        @Schema(description = "Total spendable credits", example = "850")
        long totalCredits,
        List<AllocationSummaryDto> activeAllocations
) {}
