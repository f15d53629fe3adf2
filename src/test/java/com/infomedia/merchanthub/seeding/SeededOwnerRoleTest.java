package com.infomedia.merchanthub.seeding;

import com.infomedia.merchanthub.component.modeltools.ModelConverter;
import com.infomedia.merchanthub.db.entity.Permission;
import com.infomedia.merchanthub.db.entity.Role;
import com.infomedia.merchanthub.db.entity.User;
import com.infomedia.merchanthub.db.repository.PermissionRepository;
import com.infomedia.merchanthub.db.repository.RoleRepository;
import com.infomedia.merchanthub.db.repository.UserRepository;
import com.infomedia.merchanthub.dto.role.PermissionDto;
import com.infomedia.merchanthub.dto.role.RoleDto;
import com.infomedia.merchanthub.dto.user.UserDto;
import com.infomedia.merchanthub.multitenancy.FirstUser;
import com.infomedia.merchanthub.multitenancy.TenancyProperties;
import com.infomedia.merchanthub.multitenancy.TenantContextManager;
import com.infomedia.merchanthub.multitenancy.TenantResourceResolver;
import com.infomedia.merchanthub.multitenancy.TenantScope;
import com.infomedia.merchanthub.service.TenantUserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Seeder, user service and model mapping working together on one tenant.
 */
class SeededOwnerRoleTest {

    private static final String TENANT_ID = "6f1c2a4e-0d1b-4c55-9a3e-2f7b1e9c0a11";

    private final Map<String, Role> roleTable = new LinkedHashMap<>();
    private final Map<String, Permission> permissionTable = new LinkedHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private TenantContextManager contextManager;
    private RoleSeeder roleSeeder;
    private TenantUserService userService;
    private RoleSeedingProperties seedingProperties;

    @BeforeEach
    void setUp() {
        RoleRepository roleRepository = mock(RoleRepository.class);
        when(roleRepository.findByName(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(roleTable.get(invocation.<String>getArgument(0))));
        when(roleRepository.save(any(Role.class))).thenAnswer(invocation -> {
            Role role = invocation.getArgument(0);
            if (role.getId() == null) {
                role.setId(ids.incrementAndGet());
            }
            roleTable.put(role.getName(), role);
            return role;
        });

        PermissionRepository permissionRepository = mock(PermissionRepository.class);
        when(permissionRepository.findByName(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(permissionTable.get(invocation.<String>getArgument(0))));
        when(permissionRepository.save(any(Permission.class))).thenAnswer(invocation -> {
            Permission permission = invocation.getArgument(0);
            if (permission.getId() == null) {
                permission.setId(ids.incrementAndGet());
            }
            permissionTable.put(permission.getName(), permission);
            return permission;
        });

        UserRepository userRepository = mock(UserRepository.class);
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> {
            User user = invocation.getArgument(0);
            user.setId(ids.incrementAndGet());
            return user;
        });

        PasswordEncoder passwordEncoder = mock(PasswordEncoder.class);
        when(passwordEncoder.encode(anyString())).thenReturn("{bcrypt}hashed");

        seedingProperties = new RoleSeedingProperties();
        seedingProperties.getRolesStructure().put("merchant_admin", Map.of("users", "c,r,u,d"));

        contextManager = new TenantContextManager(new TenantResourceResolver(new TenancyProperties()));
        roleSeeder = new RoleSeeder(roleRepository, permissionRepository);
        userService = new TenantUserService(userRepository, roleRepository, passwordEncoder, new ModelConverter());
    }

    @Test
    void ownerHoldsExactlyTheConfiguredAdminPermissions() {
        UserDto owner;
        try (TenantScope ignored = contextManager.enter(TENANT_ID)) {
            roleSeeder.seedRoles(seedingProperties.toStructure());
            roleSeeder.seedRoles(seedingProperties.toStructure());
            owner = userService.createUserWithRole(
                    new FirstUser("Store Owner", "owner@store1.example.com", "s3cret-pass"), "merchant_admin");
        }

        assertThat(owner.getRoles()).extracting(RoleDto::getName).containsExactly("merchant_admin");
        assertThat(owner.getRoles().get(0).getPermissions())
                .extracting(PermissionDto::getName)
                .containsExactlyInAnyOrder("create-users", "read-users", "update-users", "delete-users");
        assertThat(roleTable).containsOnlyKeys("merchant_admin");
        assertThat(permissionTable).hasSize(4);
    }
}
