package com.infomedia.merchanthub.platform;

import com.infomedia.merchanthub.service.merchant.MerchantAuthService;
import com.infomedia.merchanthub.service.merchant.MerchantRoleService;
import com.infomedia.merchanthub.service.merchant.SignUpRequestResolver;
import com.infomedia.merchanthub.service.merchant.mobile.MobileMerchantAuthService;
import com.infomedia.merchanthub.service.merchant.mobile.MobileMerchantRoleService;
import com.infomedia.merchanthub.service.merchant.mobile.MobileSignUpRequestResolver;
import com.infomedia.merchanthub.service.merchant.web.WebMerchantAuthService;
import com.infomedia.merchanthub.service.merchant.web.WebMerchantRoleService;
import com.infomedia.merchanthub.service.merchant.web.WebSignUpRequestResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Which concrete class serves each contract, per api version and platform.
 * A new platform or version is added here.
 */
@Configuration
public class PlatformBindingConfiguration {

    @Bean
    public PlatformBindingRegistry platformBindingRegistry() {
        return new PlatformBindingRegistry()
                // v1
                .register(1, MerchantAuthService.class, WebMerchantAuthService.class, Platform.WEB)
                .register(1, MerchantAuthService.class, MobileMerchantAuthService.class, Platform.MOBILE)
                .register(1, SignUpRequestResolver.class, WebSignUpRequestResolver.class, Platform.WEB)
                .register(1, SignUpRequestResolver.class, MobileSignUpRequestResolver.class, Platform.MOBILE)
                .register(1, MerchantRoleService.class, WebMerchantRoleService.class, Platform.WEB)
                .register(1, MerchantRoleService.class, MobileMerchantRoleService.class, Platform.MOBILE);
    }
}
