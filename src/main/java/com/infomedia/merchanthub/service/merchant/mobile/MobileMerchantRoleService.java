package com.infomedia.merchanthub.service.merchant.mobile;

import com.infomedia.merchanthub.db.entity.Permission;
import com.infomedia.merchanthub.db.repository.RoleRepository;
import com.infomedia.merchanthub.dto.role.RoleSummaryDto;
import com.infomedia.merchanthub.multitenancy.TenantCacheKeyGenerator;
import com.infomedia.merchanthub.service.merchant.MerchantRoleService;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class MobileMerchantRoleService implements MerchantRoleService {

    private final RoleRepository roleRepository;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CACHE_NAME, keyGenerator = TenantCacheKeyGenerator.BEAN_NAME)
    public List<RoleSummaryDto> listRoles() {
        return roleRepository.findAllPublicWithPermissions().stream()
                .map(role -> RoleSummaryDto.builder()
                        .name(role.getName())
                        .displayName(role.getDisplayName())
                        .permissions(role.getPermissions().stream()
                                .map(Permission::getName)
                                .sorted()
                                .toList())
                        .build())
                .toList();
    }
}
