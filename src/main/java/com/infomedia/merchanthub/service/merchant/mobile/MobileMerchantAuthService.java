package com.infomedia.merchanthub.service.merchant.mobile;

import com.infomedia.merchanthub.multitenancy.TenantLifecycleService;
import com.infomedia.merchanthub.platform.Platform;
import com.infomedia.merchanthub.service.merchant.AbstractMerchantAuthService;
import org.springframework.stereotype.Service;

@Service
public class MobileMerchantAuthService extends AbstractMerchantAuthService {

    public MobileMerchantAuthService(TenantLifecycleService lifecycleService) {
        super(lifecycleService);
    }

    @Override
    public String whatIsMyPlatform() {
        return "platform: mobile!";
    }

    @Override
    public Platform platform() {
        return Platform.MOBILE;
    }
}
