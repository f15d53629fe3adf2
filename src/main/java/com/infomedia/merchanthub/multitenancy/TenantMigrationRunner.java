package com.infomedia.merchanthub.multitenancy;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Brings every tenant schema up to date on startup when {@code merchanthub.tenancy.migrate-on-startup} is set.
 * Runs after the central schema is bootstrapped.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Log4j2
public class TenantMigrationRunner implements ApplicationRunner {

    private final TenancyProperties properties;
    private final TenantLifecycleService lifecycleService;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isMigrateOnStartup()) {
            log.debug("Tenant migration on startup is disabled");
            return;
        }
        TenantMigrationSummary summary = lifecycleService.migrateAllTenants();
        if (!summary.failed().isEmpty()) {
            log.error("Tenant schemas left behind after startup migration: {}", summary.failed());
        }
    }
}
