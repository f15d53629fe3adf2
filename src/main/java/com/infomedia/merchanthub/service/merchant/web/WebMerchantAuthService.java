package com.infomedia.merchanthub.service.merchant.web;

import com.infomedia.merchanthub.multitenancy.TenantLifecycleService;
import com.infomedia.merchanthub.platform.Platform;
import com.infomedia.merchanthub.service.merchant.AbstractMerchantAuthService;
import org.springframework.stereotype.Service;

@Service
public class WebMerchantAuthService extends AbstractMerchantAuthService {

    public WebMerchantAuthService(TenantLifecycleService lifecycleService) {
        super(lifecycleService);
    }

    @Override
    public String whatIsMyPlatform() {
        return "platform: website!";
    }

    @Override
    public Platform platform() {
        return Platform.WEB;
    }
}
