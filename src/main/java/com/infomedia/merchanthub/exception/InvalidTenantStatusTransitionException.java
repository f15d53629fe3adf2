package com.infomedia.merchanthub.exception;

import com.infomedia.merchanthub.db.entity.TenantStatus;

public class InvalidTenantStatusTransitionException extends RuntimeException {

    public InvalidTenantStatusTransitionException(String tenantId, TenantStatus from, TenantStatus to) {
        super("Tenant '" + tenantId + "' cannot move from '" + from.getValue() + "' to '" + to.getValue() + "'");
    }
}
