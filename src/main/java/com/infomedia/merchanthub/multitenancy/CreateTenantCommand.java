package com.infomedia.merchanthub.multitenancy;

public record CreateTenantCommand(String name, String description, String domain, FirstUser firstUser) {
}
