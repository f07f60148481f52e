package uk.gegc.accounting.features.usage.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import uk.gegc.accounting.features.usage.api.dto.UsageRecordDto;
import uk.gegc.accounting.features.usage.domain.model.UsageRecord;

import java.util.List;
import java.util.Map;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public abstract class UsageRecordMapper {

    private static final Logger log = LoggerFactory.getLogger(UsageRecordMapper.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    @Autowired
    protected ObjectMapper objectMapper;

    @Mapping(target = "metadata", source = "metadataJson")
    public abstract UsageRecordDto toDto(UsageRecord entity);

    public abstract List<UsageRecordDto> toDtos(List<UsageRecord> entities);

    protected Map<String, Object> parseMetadata(String metadataJson) {
        if (metadataJson == null || metadataJson.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(metadataJson, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Stored usage metadata is not a JSON object, returning it raw: {}", e.getOriginalMessage());
            return Map.of("raw", metadataJson);
        }
    }
}
