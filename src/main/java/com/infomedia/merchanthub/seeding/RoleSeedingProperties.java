package com.infomedia.merchanthub.seeding;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Baseline roles of every tenant. Role and module keys that contain underscores must be written
 * in bracket notation in YAML, e.g. {@code "[merchant_admin]"}.
 */
@Data
@ConfigurationProperties(prefix = "merchanthub.seeding")
public class RoleSeedingProperties {

    /**
     * Seed the baseline roles while provisioning a tenant.
     */
    private boolean enabled = true;

    /**
     * Empty the role and permission tables before reseeding. Wipes every role assignment.
     */
    private boolean truncateTables = false;

    /**
     * role -> module -> comma separated action codes, e.g. {@code users: "c,r,u,d"}.
     */
    private Map<String, Map<String, String>> rolesStructure = new LinkedHashMap<>();

    private Map<String, String> permissionsMap = new LinkedHashMap<>(Map.of(
            "c", "create",
            "r", "read",
            "u", "update",
            "d", "delete"
    ));

    private List<String> privateRoles = new ArrayList<>(List.of("super_admin"));

    private List<String> notEditableRoles = new ArrayList<>(List.of("super_admin", "merchant_admin"));

    public RoleStructure toStructure() {
        return new RoleStructure(rolesStructure, permissionsMap, new LinkedHashSet<>(privateRoles),
                new LinkedHashSet<>(notEditableRoles), truncateTables);
    }
}
