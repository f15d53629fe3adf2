package com.infomedia.merchanthub.db.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

@Getter
public enum TenantStatus {

    PENDING("pending"),
    ACTIVE("active"),
    INACTIVE("inactive"),
    SUSPENDED("suspended");

    @JsonValue
    private final String value;

    TenantStatus(String value) {
        this.value = value;
    }

    /**
     * Pending is owned by provisioning: nothing moves into it and nothing leaves it through
     * a status change. The other statuses move freely between each other.
     */
    public boolean canTransitionTo(TenantStatus target) {
        if (target == null || this == PENDING || target == PENDING) {
            return false;
        }
        return this != target;
    }

    @JsonCreator
    public static TenantStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown tenant status: " + value));
    }
}
