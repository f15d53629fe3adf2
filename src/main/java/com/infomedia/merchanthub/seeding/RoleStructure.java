package com.infomedia.merchanthub.seeding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Declarative description of the roles to seed.
 *
 * @param roles           role name -> module -> comma separated action codes
 * @param permissionsMap  action code -> action verb used in the permission slug
 * @param privateRoles    roles hidden from the merchant
 * @param notEditableRoles roles the merchant cannot modify
 * @param truncateTables  empty the role tables before seeding
 */
public record RoleStructure(Map<String, Map<String, String>> roles,
                            Map<String, String> permissionsMap,
                            Set<String> privateRoles,
                            Set<String> notEditableRoles,
                            boolean truncateTables) {

    public RoleStructure {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        roles.forEach((role, modules) -> copy.put(role, Collections.unmodifiableMap(new LinkedHashMap<>(modules))));
        roles = Collections.unmodifiableMap(copy);
        permissionsMap = Map.copyOf(permissionsMap);
        privateRoles = Set.copyOf(privateRoles);
        notEditableRoles = Set.copyOf(notEditableRoles);
    }

    public static RoleStructure of(Map<String, Map<String, String>> roles, Map<String, String> permissionsMap) {
        return new RoleStructure(roles, permissionsMap, Set.of(), Set.of(), false);
    }
}
