package com.infomedia.merchanthub.multitenancy;

public enum TenantContextState {
    CENTRAL,
    SWITCHING,
    TENANT_ACTIVE,
    RESTORING
}
