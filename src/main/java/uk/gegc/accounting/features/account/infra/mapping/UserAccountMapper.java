package uk.gegc.accounting.features.account.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.accounting.features.account.api.dto.UserAccountDto;
import uk.gegc.accounting.features.account.domain.model.UserAccount;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface UserAccountMapper {
    UserAccountDto toDto(UserAccount entity);
}
