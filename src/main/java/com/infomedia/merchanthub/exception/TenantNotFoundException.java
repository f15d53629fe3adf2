package com.infomedia.merchanthub.exception;

public class TenantNotFoundException extends RuntimeException {

    public TenantNotFoundException(String message) {
        super(message);
    }

    public static TenantNotFoundException forDomain(String domain) {
        return new TenantNotFoundException("No tenant is registered for domain '" + domain + "'");
    }

    public static TenantNotFoundException forId(String tenantId) {
        return new TenantNotFoundException("Tenant '" + tenantId + "' does not exist");
    }
}
