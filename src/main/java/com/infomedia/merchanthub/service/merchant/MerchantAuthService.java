package com.infomedia.merchanthub.service.merchant;

import com.infomedia.merchanthub.dto.auth.SignUpResponse;
import com.infomedia.merchanthub.platform.Platform;

/**
 * Merchant account operations. Bound per platform.
 */
public interface MerchantAuthService {

    /**
     * Creates the merchant's tenant and its owner account.
     */
    SignUpResponse signUp(SignUpCommand command);

    String whatIsMyPlatform();

    Platform platform();
}
