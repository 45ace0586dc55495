package com.riskguard.mapper;

import com.riskguard.domain.model.Lockout;
import com.riskguard.domain.model.LockoutKey;
import com.riskguard.entity.LockoutEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the Lockout domain model and LockoutEntity.
 *
 * <p>The entity stores account-wide lockouts under the "*" symbol key; the domain model
 * uses a null symbol.
 */
@Mapper
public interface LockoutMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(source = "symbol", target = "symbolKey", qualifiedByName = "symbolToKey")
    LockoutEntity toEntity(Lockout lockout);

    @Mapping(source = "symbolKey", target = "symbol", qualifiedByName = "keyToSymbol")
    Lockout toDomain(LockoutEntity entity);

    List<Lockout> toDomainList(List<LockoutEntity> entities);

    @Named("symbolToKey")
    default String symbolToKey(String symbol) {
        return symbol == null ? LockoutKey.ACCOUNT_WIDE : symbol.toUpperCase();
    }

    @Named("keyToSymbol")
    default String keyToSymbol(String symbolKey) {
        return symbolKey == null || LockoutKey.ACCOUNT_WIDE.equals(symbolKey) ? null : symbolKey;
    }
}
