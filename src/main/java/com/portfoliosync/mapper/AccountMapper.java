package com.portfoliosync.mapper;

import com.portfoliosync.api.dto.request.CreateAccountRequest;
import com.portfoliosync.api.dto.request.UpdateAccountRequest;
import com.portfoliosync.api.dto.response.AccountResponse;
import com.portfoliosync.domain.model.AccountCredentials;
import com.portfoliosync.domain.model.LoginCredentials;
import com.portfoliosync.entity.AccountEntity;
import java.util.List;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;

/**
 * MapStruct mapper for accounts: entity to per-call credentials, API views, the create
 * request to a new entity, and edits applied onto an existing one.
 */
@Mapper
public interface AccountMapper {

    AccountCredentials toCredentials(AccountEntity entity);

    LoginCredentials toLoginCredentials(AccountEntity entity);

    @Mapping(target = "hasApiCredentials", expression = "java(entity.getApiKey() != null && entity.getApiSecret() != null)")
    @Mapping(target = "hasRequestToken", expression = "java(entity.getRequestToken() != null)")
    @Mapping(target = "hasTotpSecret", expression = "java(entity.getTotpSecret() != null)")
    AccountResponse toResponse(AccountEntity entity);

    List<AccountResponse> toResponseList(List<AccountEntity> entities);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "requestToken", ignore = true)
    @Mapping(target = "active", ignore = true)
    @Mapping(target = "lastSync", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    AccountEntity toEntity(CreateAccountRequest request);

    // Update existing entity from request; null fields keep their stored value
    @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "active", ignore = true)
    @Mapping(target = "lastSync", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    void updateFromRequest(UpdateAccountRequest request, @MappingTarget AccountEntity entity);
}
