package com.infomedia.merchanthub.service.merchant;

import java.util.List;

/**
 * Roles of the tenant serving the request. Bound per platform; each platform decides the
 * shape of the listing.
 */
public interface MerchantRoleService {

    String CACHE_NAME = "merchant-roles";

    List<?> listRoles();
}
