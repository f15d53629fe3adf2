package com.infomedia.merchanthub.service.merchant;

import com.infomedia.merchanthub.multitenancy.FirstUser;

/**
 * A validated sign-up: the merchant's full domain has been derived and checked for availability.
 */
public record SignUpCommand(String merchantName, String merchantDescription, String merchantDomain, FirstUser owner) {
}
