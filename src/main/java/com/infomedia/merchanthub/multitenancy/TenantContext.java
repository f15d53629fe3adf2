package com.infomedia.merchanthub.multitenancy;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Tenant of the unit of work running on the current thread. Only {@link TenantContextManager}
 * switches it; everybody else reads.
 */
public final class TenantContext {

    private static final ThreadLocal<TenantResources> CURRENT_TENANT = new ThreadLocal<>();
    private static final ThreadLocal<TenantContextState> STATE = new ThreadLocal<>();

    // Matches %X{tenant} in log4j2-spring.xml
    private static final String MDC_KEY = "tenant";

    private TenantContext() {
    }

    public static Optional<TenantResources> current() {
        return Optional.ofNullable(CURRENT_TENANT.get());
    }

    public static TenantResources requireCurrent() {
        TenantResources resources = CURRENT_TENANT.get();
        if (resources == null) {
            throw new IllegalStateException("No tenant context is active on this thread");
        }
        return resources;
    }

    public static String getTenant() {
        TenantResources resources = CURRENT_TENANT.get();
        return resources != null ? resources.tenantId() : null;
    }

    public static TenantContextState getState() {
        TenantContextState state = STATE.get();
        return state != null ? state : TenantContextState.CENTRAL;
    }

    static void transition(TenantContextState state) {
        STATE.set(state);
    }

    static void activate(TenantResources resources) {
        CURRENT_TENANT.set(resources);
        STATE.set(TenantContextState.TENANT_ACTIVE);
        MDC.put(MDC_KEY, resources.tenantId());
    }

    static void clear() {
        CURRENT_TENANT.remove();
        STATE.remove();
        MDC.remove(MDC_KEY);
    }
}
