package uk.gegc.accounting.features.usage.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "SystemUsageStatsDto", description = "System-wide credit usage")
public record SystemUsageStatsDto(
        long totalRecords,
        long totalCredits,
        @Schema(description = "Credits per user id")
        Map<String, Long> byUser,
        Map<String, Long> byService,
        Map<String, Long> byDay,
        Map<String, Long> byModel
) {}
