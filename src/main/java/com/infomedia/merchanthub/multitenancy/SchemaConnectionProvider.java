package com.infomedia.merchanthub.multitenancy;

import lombok.extern.log4j.Log4j2;
import org.hibernate.engine.jdbc.connections.spi.MultiTenantConnectionProvider;
import org.hibernate.service.UnknownUnwrapTypeException;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.regex.Pattern;

@Log4j2
@Component
public class SchemaConnectionProvider implements MultiTenantConnectionProvider<String> {

    private static final Pattern SCHEMA_NAME = Pattern.compile("^[a-z_][a-z0-9_]*$");

    private final DataSource dataSource;
    private final TenancyProperties properties;

    public SchemaConnectionProvider(DataSource dataSource, TenancyProperties properties) {
        this.dataSource = dataSource;
        this.properties = properties;
    }

    @Override
    public Connection getAnyConnection() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void releaseAnyConnection(Connection connection) throws SQLException {
        connection.close();
    }

    @Override
    public Connection getConnection(String tenantIdentifier) throws SQLException {
        String schema = tenantIdentifier != null ? tenantIdentifier : properties.getCentralSchema();
        if (!SCHEMA_NAME.matcher(schema).matches()) {
            throw new SQLException("Refusing to switch to malformed schema name [" + schema + "]");
        }
        Connection connection = getAnyConnection();
        try (Statement statement = connection.createStatement()) {
            statement.execute("SET search_path TO \"" + schema + "\"");
        } catch (SQLException e) {
            connection.close();
            throw new SQLException("Could not alter JDBC connection to specified schema [" + schema + "]", e);
        }
        return connection;
    }

    @Override
    public void releaseConnection(String tenantIdentifier, Connection connection) throws SQLException {
        // Pooled connections go back pointing at the central schema
        try (Statement statement = connection.createStatement()) {
            statement.execute("SET search_path TO \"" + properties.getCentralSchema() + "\"");
        } catch (SQLException e) {
            log.warn("Could not reset search_path after use by [{}]: {}", tenantIdentifier, e.getMessage());
        }
        connection.close();
    }

    @Override
    public boolean supportsAggressiveRelease() {
        return false;
    }

    @Override
    public boolean isUnwrappableAs(Class<?> unwrapType) {
        return unwrapType.isInstance(this);
    }

    @Override
    public <T> T unwrap(Class<T> unwrapType) {
        if (isUnwrappableAs(unwrapType)) {
            return unwrapType.cast(this);
        }
        throw new UnknownUnwrapTypeException(unwrapType);
    }
}
