package com.infomedia.merchanthub.service.merchant;

import com.infomedia.merchanthub.dto.auth.SignUpRequest;
import com.infomedia.merchanthub.platform.Platform;

/**
 * Turns a raw sign-up body into a {@link SignUpCommand}. Bound per platform.
 */
public interface SignUpRequestResolver {

    SignUpCommand resolve(SignUpRequest request);

    Platform platform();
}
