package uk.gegc.accounting.features.usage.application;

import uk.gegc.accounting.features.usage.api.dto.SystemUsageStatsDto;
import uk.gegc.accounting.features.usage.api.dto.UsageRecordDto;
import uk.gegc.accounting.features.usage.api.dto.UserUsageStatsDto;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Append-only log of completed metered operations, with aggregate statistics computed at query time.
 */
public interface UsageRecorderService {

    /**
     * @param credits zero or positive
     */
    UsageRecordDto record(String userId, String service, String operation, long credits, Map<String, Object> metadata);

    UserUsageStatsDto getUserStats(String userId, LocalDateTime from, LocalDateTime to);

    SystemUsageStatsDto getSystemStats(LocalDateTime from, LocalDateTime to);
}
