package com.infomedia.merchanthub.multitenancy;

import java.util.List;

public record TenantMigrationSummary(List<String> migrated, List<String> failed) {
}
