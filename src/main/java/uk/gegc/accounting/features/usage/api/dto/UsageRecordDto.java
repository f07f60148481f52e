package uk.gegc.accounting.features.usage.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

@Schema(name = "UsageRecordDto", description = "A completed metered operation")
public record UsageRecordDto(
        UUID id,
        String userId,
        LocalDateTime timestamp,
        @Schema(example = "chat-streaming")
        String service,
        @Schema(description = "Operation, usually the model identifier", example = "amazon.nova-lite-v1:0")
        String operation,
        long credits,
        Map<String, Object> metadata
) {}
