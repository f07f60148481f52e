package uk.gegc.accounting.features.credit.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.accounting.features.credit.api.dto.AllocationSummaryDto;
import uk.gegc.accounting.features.credit.api.dto.CreditAllocationDto;
import uk.gegc.accounting.features.credit.domain.model.CreditAllocation;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface CreditAllocationMapper {
    CreditAllocationDto toDto(CreditAllocation entity);
    List<CreditAllocationDto> toDtos(List<CreditAllocation> entities);
    AllocationSummaryDto toSummary(CreditAllocation entity);
}
