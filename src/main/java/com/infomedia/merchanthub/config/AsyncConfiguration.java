package com.infomedia.merchanthub.config;

import com.infomedia.merchanthub.multitenancy.TenantAwareTaskDecorator;
import com.infomedia.merchanthub.multitenancy.TenantContextManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfiguration {

    @Value("${merchanthub.jobs.core-pool-size:2}")
    private int corePoolSize;

    @Value("${merchanthub.jobs.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${merchanthub.jobs.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = "tenantJobExecutor")
    public ThreadPoolTaskExecutor tenantJobExecutor(TenantContextManager contextManager) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("tenant-job-");
        executor.setTaskDecorator(new TenantAwareTaskDecorator(contextManager));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
