package com.infomedia.merchanthub.seeding;

import com.infomedia.merchanthub.db.entity.Permission;
import com.infomedia.merchanthub.db.entity.Role;
import com.infomedia.merchanthub.db.repository.PermissionRepository;
import com.infomedia.merchanthub.db.repository.RoleRepository;
import com.infomedia.merchanthub.multitenancy.TenantContext;
import com.infomedia.merchanthub.multitenancy.TenantResources;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Brings the roles and permissions of the active tenant in line with a {@link RoleStructure}.
 * Roles and permissions are upserted by name and each role's permission set is replaced, so
 * seeding twice leaves the same rows as seeding once.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class RoleSeeder {

    static final List<String> TRUNCATED_TABLES = List.of("permission_role", "role_user", "roles", "permissions");

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional
    public void seedRoles(RoleStructure structure) {
        TenantResources tenant = TenantContext.current()
                .orElseThrow(() -> new IllegalStateException("Role seeding requires an active tenant context"));

        if (structure.truncateTables()) {
            truncate(tenant);
        }

        Map<String, Permission> permissions = new HashMap<>();
        structure.roles().forEach((roleName, modules) -> {
            Role role = roleRepository.findByName(roleName)
                    .orElseGet(() -> Role.builder().name(roleName).build());

            String displayName = displayName(roleName);
            role.setDisplayName(displayName);
            role.setDescription(displayName);
            role.setPrivate(structure.privateRoles().contains(roleName));
            role.setEditable(!structure.notEditableRoles().contains(roleName));

            Set<Permission> granted = new LinkedHashSet<>();
            modules.forEach((module, codes) -> {
                for (String code : codes.split(",")) {
                    String action = structure.permissionsMap().get(code.trim());
                    if (action == null) {
                        log.warn("Skipping unknown permission code '{}' for module '{}' of role '{}'",
                                code.trim(), module, roleName);
                        continue;
                    }
                    String slug = action + "-" + module;
                    granted.add(permissions.computeIfAbsent(slug, this::upsertPermission));
                }
            });

            role.getPermissions().clear();
            role.getPermissions().addAll(granted);
            roleRepository.save(role);
            log.debug("Seeded role {} with {} permission(s)", roleName, granted.size());
        });

        log.info("Seeded {} role(s) and {} permission(s) for tenant {}",
                structure.roles().size(), permissions.size(), tenant.tenantId());
    }

    private Permission upsertPermission(String slug) {
        return permissionRepository.findByName(slug)
                .orElseGet(() -> permissionRepository.save(Permission.builder()
                        .name(slug)
                        .displayName(displayName(slug))
                        .build()));
    }

    private void truncate(TenantResources tenant) {
        String schema = tenant.databaseName();
        String tables = TRUNCATED_TABLES.stream()
                .map(table -> "\"" + schema + "\".\"" + table + "\"")
                .collect(Collectors.joining(", "));

        log.warn("Truncating role tables of tenant {} ({})", tenant.tenantId(), schema);
        // Foreign key triggers stay off only until the end of this block
        entityManager.createNativeQuery("SET LOCAL session_replication_role = replica").executeUpdate();
        try {
            entityManager.createNativeQuery("TRUNCATE TABLE " + tables + " RESTART IDENTITY").executeUpdate();
        } finally {
            entityManager.createNativeQuery("SET LOCAL session_replication_role = origin").executeUpdate();
        }
        entityManager.clear();
    }

    static String displayName(String key) {
        return Arrays.stream(key.split("[_-]"))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
                .collect(Collectors.joining(" "));
    }
}
