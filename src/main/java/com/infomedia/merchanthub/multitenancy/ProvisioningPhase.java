package com.infomedia.merchanthub.multitenancy;

/**
 * Steps of a tenant creation, in execution order. Logged when provisioning fails.
 */
public enum ProvisioningPhase {
    REGISTER,
    CREATE_DATABASE,
    MIGRATE,
    SEED_ROLES,
    CREATE_FIRST_USER,
    ACTIVATE
}
