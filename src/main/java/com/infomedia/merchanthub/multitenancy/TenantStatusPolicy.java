package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.db.entity.Tenant;
import com.infomedia.merchanthub.db.entity.TenantStatus;

/**
 * Decides the status a freshly provisioned tenant starts in.
 */
@FunctionalInterface
public interface TenantStatusPolicy {

    TenantStatus initialStatus(Tenant tenant);
}
