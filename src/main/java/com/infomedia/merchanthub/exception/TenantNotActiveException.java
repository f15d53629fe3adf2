package com.infomedia.merchanthub.exception;

import com.infomedia.merchanthub.db.entity.TenantStatus;

public class TenantNotActiveException extends RuntimeException {

    public TenantNotActiveException(String domain, TenantStatus status) {
        super("Tenant for domain '" + domain + "' is " + status.getValue());
    }
}
