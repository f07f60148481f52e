package uk.gegc.accounting.features.usage.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.accounting.features.usage.api.dto.SystemUsageStatsDto;
import uk.gegc.accounting.features.usage.api.dto.UsageRecordDto;
import uk.gegc.accounting.features.usage.api.dto.UserUsageStatsDto;
import uk.gegc.accounting.features.usage.application.UsageRecorderService;
import uk.gegc.accounting.features.usage.domain.model.UsageRecord;
import uk.gegc.accounting.features.usage.infra.mapping.UsageRecordMapper;
import uk.gegc.accounting.features.usage.infra.repository.UsageRecordRepository;
import uk.gegc.accounting.shared.exception.InvalidAmountException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
public class UsageRecorderServiceImpl implements UsageRecorderService {

    private static final Logger log = LoggerFactory.getLogger(UsageRecorderServiceImpl.class);
    private static final int RECENT_ACTIVITY_LIMIT = 10;
    private static final int MAX_METADATA_LENGTH = 4000;
    // open range ends, kept inside what a DATETIME column can hold
    private static final LocalDateTime RANGE_START = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime RANGE_END = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private final UsageRecordRepository usageRecordRepository;
    private final UsageRecordMapper usageRecordMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public UsageRecordDto record(String userId, String service, String operation, long credits, Map<String, Object> metadata) {
        if (credits < 0) {
            throw new InvalidAmountException("Usage credits must be zero or positive");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (service == null || service.isBlank() || operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("service and operation must not be blank");
        }

        UsageRecord record = new UsageRecord();
        record.setUserId(userId);
        record.setTimestamp(LocalDateTime.now(clock));
        record.setService(service);
        record.setOperation(operation);
        record.setCredits(credits);
        record.setMetadataJson(buildMetadataJson(metadata));

        UsageRecord saved = usageRecordRepository.save(record);
        log.debug("Recorded usage {} for user {}: {}/{} = {} credits",
                saved.getId(), userId, service, operation, credits);
        return usageRecordMapper.toDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public UserUsageStatsDto getUserStats(String userId, LocalDateTime from, LocalDateTime to) {
        requireOrderedRange(from, to);
        List<UsageRecord> records = usageRecordRepository.findByUserIdInRange(
                userId, from != null ? from : RANGE_START, to != null ? to : RANGE_END);

        List<UsageRecord> recent = records.stream().limit(RECENT_ACTIVITY_LIMIT).toList();
        return new UserUsageStatsDto(
                userId,
                records.size(),
                totalCredits(records),
                creditsBy(records, UsageRecord::getService),
                creditsByDay(records),
                creditsBy(records, UsageRecord::getOperation),
                usageRecordMapper.toDtos(recent)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public SystemUsageStatsDto getSystemStats(LocalDateTime from, LocalDateTime to) {
        requireOrderedRange(from, to);
        List<UsageRecord> records = usageRecordRepository.findInRange(
                from != null ? from : RANGE_START, to != null ? to : RANGE_END);

        return new SystemUsageStatsDto(
                records.size(),
                totalCredits(records),
                creditsBy(records, UsageRecord::getUserId),
                creditsBy(records, UsageRecord::getService),
                creditsByDay(records),
                creditsBy(records, UsageRecord::getOperation)
        );
    }

    private String buildMetadataJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            String json = objectMapper.writeValueAsString(metadata);
            if (json.length() > MAX_METADATA_LENGTH) {
                throw new IllegalArgumentException("Usage metadata exceeds " + MAX_METADATA_LENGTH + " characters");
            }
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Usage metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static void requireOrderedRange(LocalDateTime from, LocalDateTime to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
    }

    private static long totalCredits(List<UsageRecord> records) {
        return records.stream().mapToLong(UsageRecord::getCredits).sum();
    }

    private static Map<String, Long> creditsBy(List<UsageRecord> records, Function<UsageRecord, String> key) {
        Map<String, Long> totals = new LinkedHashMap<>();
        for (UsageRecord record : records) {
            totals.merge(key.apply(record), record.getCredits(), Long::sum);
        }
        return totals;
    }

    private static Map<String, Long> creditsByDay(List<UsageRecord> records) {
        Map<String, Long> totals = new TreeMap<>();
        for (UsageRecord record : records) {
            totals.merge(record.getTimestamp().toLocalDate().toString(), record.getCredits(), Long::sum);
        }
        return totals;
    }
}
