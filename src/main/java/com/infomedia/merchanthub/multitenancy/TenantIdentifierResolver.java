package com.infomedia.merchanthub.multitenancy;

import lombok.RequiredArgsConstructor;
import org.hibernate.context.spi.CurrentTenantIdentifierResolver;
import org.springframework.stereotype.Component;

/**
 * Hands Hibernate the schema of the active tenant, or the central schema outside any tenant context.
 */
@Component
@RequiredArgsConstructor
public class TenantIdentifierResolver implements CurrentTenantIdentifierResolver<String> {

    private final TenancyProperties properties;

    @Override
    public String resolveCurrentTenantIdentifier() {
        return TenantContext.current()
                .map(TenantResources::databaseName)
                .orElse(properties.getCentralSchema());
    }

    @Override
    public boolean validateExistingCurrentSessions() {
        return true;
    }
}
