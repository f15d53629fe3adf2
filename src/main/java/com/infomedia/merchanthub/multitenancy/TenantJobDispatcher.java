package com.infomedia.merchanthub.multitenancy;

import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Runs background work for a tenant on the tenant job executor. The job executes inside the
 * tenant's context and is logged under the tenant's queue name.
 */
@Component
@Log4j2
public class TenantJobDispatcher {

    private final TenantContextManager contextManager;
    private final TenantResourceResolver resourceResolver;
    private final TaskExecutor executor;

    public TenantJobDispatcher(TenantContextManager contextManager, TenantResourceResolver resourceResolver,
                               @Qualifier("tenantJobExecutor") TaskExecutor executor) {
        this.contextManager = contextManager;
        this.resourceResolver = resourceResolver;
        this.executor = executor;
    }

    public CompletableFuture<Void> dispatch(String tenantId, String jobName, Runnable job) {
        String queue = resourceResolver.resolve(tenantId).queueName();
        log.info("Queued job {} on {}", jobName, queue);

        return CompletableFuture.runAsync(() -> {
            try (TenantScope ignored = contextManager.enter(tenantId)) {
                log.info("Running job {} on {}", jobName, queue);
                job.run();
                log.info("Job {} on {} finished", jobName, queue);
            } catch (RuntimeException e) {
                log.error("Job {} on {} failed", jobName, queue, e);
                throw e;
            }
        }, executor);
    }
}
