package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.exception.NestedTenantContextException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Switches the current unit of work to a tenant's isolated resources and back.
 * <p>
 * The context is confined to the calling thread, so concurrent requests for different
 * tenants never see each other's handles. A thread may hold one tenant at a time: entering
 * a second, different tenant fails with {@link NestedTenantContextException}, entering the
 * same tenant again joins the active scope.
 */
@Component
@RequiredArgsConstructor
@Log4j2
public class TenantContextManager {

    private final TenantResourceResolver resourceResolver;

    public TenantScope enter(String tenantId) {
        Optional<TenantResources> active = TenantContext.current();
        if (active.isPresent()) {
            if (active.get().tenantId().equals(tenantId)) {
                return new TenantScope(active.get(), this, false);
            }
            throw new NestedTenantContextException(active.get().tenantId(), tenantId);
        }

        TenantContext.transition(TenantContextState.SWITCHING);
        try {
            TenantResources resources = resourceResolver.resolve(tenantId);
            TenantContext.activate(resources);
            log.debug("Entered tenant context {} (schema {})", tenantId, resources.databaseName());
            return new TenantScope(resources, this, true);
        } catch (RuntimeException e) {
            TenantContext.clear();
            throw e;
        }
    }

    void exit(TenantScope scope) {
        TenantContext.transition(TenantContextState.RESTORING);
        TenantContext.clear();
        log.debug("Left tenant context {}", scope.getTenantId());
    }

    public <T> T runInTenantContext(String tenantId, Supplier<T> work) {
        try (TenantScope ignored = enter(tenantId)) {
            return work.get();
        }
    }

    public void runInTenantContext(String tenantId, Runnable work) {
        try (TenantScope ignored = enter(tenantId)) {
            work.run();
        }
    }

    public boolean isCentral() {
        return TenantContext.current().isEmpty();
    }
}
