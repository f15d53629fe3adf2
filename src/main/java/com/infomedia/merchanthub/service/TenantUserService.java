package com.infomedia.merchanthub.service;

import com.infomedia.merchanthub.component.modeltools.ModelConverter;
import com.infomedia.merchanthub.db.entity.Role;
import com.infomedia.merchanthub.db.entity.User;
import com.infomedia.merchanthub.db.entity.UserStatus;
import com.infomedia.merchanthub.db.repository.RoleRepository;
import com.infomedia.merchanthub.db.repository.UserRepository;
import com.infomedia.merchanthub.dto.user.UserDto;
import com.infomedia.merchanthub.multitenancy.FirstUser;
import com.infomedia.merchanthub.multitenancy.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Users of the active tenant.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class TenantUserService {

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final PasswordEncoder passwordEncoder;
    private final ModelConverter modelConverter;

    /**
     * Creates an active user holding {@code roleName}. The role is created bare when the tenant
     * has not been seeded.
     */
    @Transactional
    public UserDto createUserWithRole(FirstUser firstUser, String roleName) {
        String tenantId = TenantContext.requireCurrent().tenantId();

        Role role = roleRepository.findByName(roleName)
                .orElseGet(() -> {
                    log.info("Role {} missing in tenant {}, creating it", roleName, tenantId);
                    return roleRepository.save(Role.builder()
                            .name(roleName)
                            .displayName(roleName)
                            .isEditable(false)
                            .build());
                });

        User user = User.builder()
                .name(firstUser.name())
                .email(firstUser.email())
                .password(passwordEncoder.encode(firstUser.password()))
                .status(UserStatus.ACTIVE)
                .build();
        user.getRoles().add(role);

        User saved = userRepository.save(user);
        log.info("Created user {} with role {} in tenant {}", saved.getEmail(), roleName, tenantId);
        return modelConverter.map(saved, UserDto.class);
    }
}
