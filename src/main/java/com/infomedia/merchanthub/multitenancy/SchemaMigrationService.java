package com.infomedia.merchanthub.multitenancy;

import liquibase.Liquibase;
import liquibase.database.Database;
import liquibase.database.DatabaseFactory;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.LiquibaseException;
import liquibase.resource.ClassLoaderResourceAccessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema level operations: creating and dropping tenant schemas and bringing the central
 * and tenant schemas up to date with their Liquibase changelogs.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class SchemaMigrationService {

    private final DataSource dataSource;
    private final TenancyProperties properties;
    private final TenantResourceResolver resourceResolver;

    @Value("${merchanthub.liquibase.central-changelog:db/changelog/central/db.changelog-central.yaml}")
    private String centralChangelog;

    @Value("${merchanthub.liquibase.tenant-changelog:db/changelog/tenant/db.changelog-tenant.yaml}")
    private String tenantChangelog;

    public boolean schemaExists(String schemaName) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(
                     "SELECT count(*) FROM information_schema.schemata WHERE schema_name = ?")) {
            ps.setString(1, schemaName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) > 0;
            }
        }
    }

    public void createSchema(String schemaName) throws SQLException {
        guardTenantSchema(schemaName);
        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE SCHEMA \"" + schemaName + "\"");
        }
        log.info("Schema created: {}", schemaName);
    }

    public void dropSchema(String schemaName) throws SQLException {
        guardTenantSchema(schemaName);
        log.warn("DESTRUCTIVE ACTION: Dropping schema {}", schemaName);

        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute("DROP SCHEMA IF EXISTS \"" + schemaName + "\" CASCADE");
        }
        log.info("Schema dropped successfully: {}", schemaName);
    }

    public void migrateCentralSchema() throws SQLException, LiquibaseException {
        log.info("Bootstrapping central schema: {}", properties.getCentralSchema());
        update(properties.getCentralSchema(), centralChangelog);
        log.info("Central schema is up to date.");
    }

    /**
     * Applies the tenant changelog to the schema of the tenant whose context is active.
     */
    public void migrateCurrentTenant() throws SQLException, LiquibaseException {
        TenantResources resources = TenantContext.requireCurrent();
        update(resources.databaseName(), tenantChangelog);
        log.info("Tenant schema {} is up to date.", resources.databaseName());
    }

    private void update(String schemaName, String changelog) throws SQLException, LiquibaseException {
        try (Connection connection = dataSource.getConnection()) {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("SET search_path TO \"" + schemaName + "\"");
            }

            Database targetDatabase = DatabaseFactory.getInstance()
                    .findCorrectDatabaseImplementation(new JdbcConnection(connection));
            targetDatabase.setDefaultSchemaName(schemaName);
            targetDatabase.setLiquibaseSchemaName(schemaName);

            try {
                Liquibase liquibase = new Liquibase(changelog, new ClassLoaderResourceAccessor(), targetDatabase);
                liquibase.update("");
            } finally {
                // Pooled connection goes back pointing at the central schema
                try (Statement stmt = connection.createStatement()) {
                    stmt.execute("SET search_path TO \"" + properties.getCentralSchema() + "\"");
                }
            }
        }
    }

    private void guardTenantSchema(String schemaName) {
        if (resourceResolver.isReserved(schemaName)) {
            throw new IllegalArgumentException("Cannot create or drop system or central schema '" + schemaName + "'.");
        }
    }
}
