package com.infomedia.merchanthub.multitenancy;

/**
 * Handles of everything a tenant owns in isolation.
 *
 * @param tenantId      tenant identifier
 * @param databaseName  schema holding the tenant tables
 * @param cacheNamespace prefix of every cache key written for the tenant
 * @param fileNamespace object storage bucket of the tenant
 * @param queueName     name background jobs of the tenant are reported under
 */
public record TenantResources(String tenantId, String databaseName, String cacheNamespace,
                              String fileNamespace, String queueName) {
}
