package com.infomedia.merchanthub.service.merchant.mobile;

import com.infomedia.merchanthub.multitenancy.TenancyProperties;
import com.infomedia.merchanthub.multitenancy.TenantDirectoryService;
import com.infomedia.merchanthub.platform.Platform;
import com.infomedia.merchanthub.service.merchant.AbstractSignUpRequestResolver;
import org.springframework.stereotype.Component;

@Component
public class MobileSignUpRequestResolver extends AbstractSignUpRequestResolver {

    public MobileSignUpRequestResolver(TenantDirectoryService directoryService, TenancyProperties tenancyProperties) {
        super(directoryService, tenancyProperties);
    }

    @Override
    public Platform platform() {
        return Platform.MOBILE;
    }
}
