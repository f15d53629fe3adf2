package com.infomedia.merchanthub.exception;

import lombok.Getter;

@Getter
public class TenantDeletionException extends RuntimeException {

    private final String tenantId;
    private final String phase;

    public TenantDeletionException(String tenantId, String phase, Throwable cause) {
        super("Deleting tenant '" + tenantId + "' failed while " + phase, cause);
        this.tenantId = tenantId;
        this.phase = phase;
    }
}
