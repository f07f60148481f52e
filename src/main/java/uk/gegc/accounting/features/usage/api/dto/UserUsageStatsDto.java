package uk.gegc.accounting.features.usage.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(name = "UserUsageStatsDto", description = "Credit usage of one user, aggregated from the usage log")
public record UserUsageStatsDto(
        String userId,
        long totalRecords,
        long totalCredits,
        @Schema(description = "Credits per service")
        Map<String, Long> byService,
        @Schema(description = "Credits per UTC day (yyyy-MM-dd), ascending")
        Map<String, Long> byDay,
        @Schema(description = "Credits per operation/model")
        Map<String, Long> byModel,
        @Schema(description = "Ten most recent records, newest first")
        List<UsageRecordDto> recentActivity
) {}
