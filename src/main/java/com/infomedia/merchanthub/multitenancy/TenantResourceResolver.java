package com.infomedia.merchanthub.multitenancy;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives the names of a tenant's isolated resources from its id. Pure and deterministic:
 * the same id always yields the same schema, cache namespace, bucket and queue.
 */
@Component
@RequiredArgsConstructor
public class TenantResourceResolver {

    private static final int MAX_IDENTIFIER_LENGTH = 63;
    private static final Pattern SCHEMA_NAME = Pattern.compile("^[a-z][a-z0-9_]*$");
    private static final Pattern BUCKET_NAME = Pattern.compile("^[a-z0-9][a-z0-9.-]{1,61}[a-z0-9]$");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "public", "postgres", "information_schema", "pg_catalog",
            "user", "authorization", "admin", "null", "system", "role", "group"
    );

    private final TenancyProperties properties;

    public TenantResources resolve(String tenantId) {
        String compactId = compact(tenantId);
        return new TenantResources(
                tenantId,
                databaseNameFor(tenantId),
                properties.getCachePrefix() + compactId + ":",
                bucketNameFor(compactId),
                properties.getQueuePrefix() + compactId
        );
    }

    public String databaseNameFor(String tenantId) {
        String name = (properties.getSchemaPrefix() + compact(tenantId)).toLowerCase(Locale.ROOT);
        validateSchemaName(name);
        return name;
    }

    public boolean isReserved(String schemaName) {
        return schemaName == null
                || RESERVED_WORDS.contains(schemaName.toLowerCase(Locale.ROOT))
                || schemaName.toLowerCase(Locale.ROOT).startsWith("pg_")
                || schemaName.equalsIgnoreCase(properties.getCentralSchema());
    }

    private String bucketNameFor(String compactId) {
        String name = (properties.getBucketPrefix() + compactId).toLowerCase(Locale.ROOT).replace('_', '-');
        if (!BUCKET_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Tenant bucket name '" + name + "' is not a valid bucket name.");
        }
        return name;
    }

    private void validateSchemaName(String name) {
        if (name.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException("Tenant schema name exceeds maximum length of " + MAX_IDENTIFIER_LENGTH + " characters.");
        }
        if (!SCHEMA_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Tenant schema name must start with a letter and contain only lowercase letters, numbers, and underscores.");
        }
        if (isReserved(name)) {
            throw new IllegalArgumentException("Tenant schema name '" + name + "' is a reserved word.");
        }
    }

    private static String compact(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID cannot be empty.");
        }
        return tenantId.trim().replace("-", "").toLowerCase(Locale.ROOT);
    }
}
