package com.infomedia.merchanthub.db.entity;

public enum UserStatus {
    INACTIVE,
    ACTIVE,
    PENDING,
    SUSPENDED
}
