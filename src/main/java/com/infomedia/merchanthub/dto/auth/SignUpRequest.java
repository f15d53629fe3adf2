package com.infomedia.merchanthub.dto.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Merchant sign-up body. The subdomain is normalised and checked by the platform's
 * {@link com.infomedia.merchanthub.service.merchant.SignUpRequestResolver}.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SignUpRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    @NotBlank
    @Email
    @Size(max = 255)
    private String email;

    @NotBlank
    @Size(min = 8, max = 255)
    private String password;

    @NotBlank
    @Size(max = 255)
    private String merchantName;

    private String merchantDescription;

    @NotBlank
    private String merchantSubdomain;
}
