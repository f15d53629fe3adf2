package com.infomedia.merchanthub.exception;

/**
 * Opaque failure returned to callers once a tenant creation has been rolled back.
 * The message never carries storage details; the cause is kept for operator logs only.
 */
public class TenantProvisioningException extends RuntimeException {

    public static final String MESSAGE = "Tenant provisioning failed";

    public TenantProvisioningException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
