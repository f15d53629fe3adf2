package com.infomedia.merchanthub.multitenancy;

import lombok.RequiredArgsConstructor;
import org.springframework.core.task.TaskDecorator;
import org.springframework.lang.NonNull;

/**
 * Runs a task in the tenant context of the thread that submitted it.
 */
@RequiredArgsConstructor
public class TenantAwareTaskDecorator implements TaskDecorator {

    private final TenantContextManager contextManager;

    @Override
    @NonNull
    public Runnable decorate(@NonNull Runnable runnable) {
        String tenantId = TenantContext.getTenant();
        if (tenantId == null) {
            return runnable;
        }
        return () -> {
            try (TenantScope ignored = contextManager.enter(tenantId)) {
                runnable.run();
            }
        };
    }
}
