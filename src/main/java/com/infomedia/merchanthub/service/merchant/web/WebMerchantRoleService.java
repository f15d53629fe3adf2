package com.infomedia.merchanthub.service.merchant.web;

import com.infomedia.merchanthub.component.modeltools.ModelConverter;
import com.infomedia.merchanthub.db.repository.RoleRepository;
import com.infomedia.merchanthub.dto.role.RoleDto;
import com.infomedia.merchanthub.multitenancy.TenantCacheKeyGenerator;
import com.infomedia.merchanthub.service.merchant.MerchantRoleService;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class WebMerchantRoleService implements MerchantRoleService {

    private final RoleRepository roleRepository;
    private final ModelConverter modelConverter;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CACHE_NAME, keyGenerator = TenantCacheKeyGenerator.BEAN_NAME)
    public List<RoleDto> listRoles() {
        return modelConverter.mapList(roleRepository.findAllPublicWithPermissions(), RoleDto.class);
    }
}
