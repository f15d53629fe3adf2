package com.infomedia.merchanthub.exception;

import lombok.Getter;

@Getter
public class TenantMigrationException extends RuntimeException {

    private final String tenantId;

    public TenantMigrationException(String tenantId, Throwable cause) {
        super("Migrating the database of tenant '" + tenantId + "' failed", cause);
        this.tenantId = tenantId;
    }
}
