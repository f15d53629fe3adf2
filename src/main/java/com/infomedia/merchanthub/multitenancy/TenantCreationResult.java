package com.infomedia.merchanthub.multitenancy;

import com.infomedia.merchanthub.dto.tenant.TenantDto;
import com.infomedia.merchanthub.dto.user.UserDto;

public record TenantCreationResult(TenantDto tenant, UserDto user) {
}
