package uk.gegc.accounting.features.streaming.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.accounting.features.streaming.api.dto.StreamingSessionDto;
import uk.gegc.accounting.features.streaming.domain.model.StreamingSession;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface StreamingSessionMapper {
    StreamingSessionDto toDto(StreamingSession entity);
    List<StreamingSessionDto> toDtos(List<StreamingSession> entities);
}
