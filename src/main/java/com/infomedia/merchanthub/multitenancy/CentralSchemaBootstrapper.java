package com.infomedia.merchanthub.multitenancy;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(0)
@RequiredArgsConstructor
@Log4j2
public class CentralSchemaBootstrapper implements ApplicationRunner {

    private final SchemaMigrationService schemaMigrationService;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        log.info("BOOTSTRAP: Initializing central schema...");
        try {
            schemaMigrationService.migrateCentralSchema();
        } catch (Exception e) {
            // Without the tenant directory no request can be routed
            log.error("BOOTSTRAP: Failed to initialize central schema.", e);
            throw e;
        }
        log.info("BOOTSTRAP: Central schema ready.");
    }
}
