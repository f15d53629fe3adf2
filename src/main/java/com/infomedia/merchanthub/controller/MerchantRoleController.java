package com.infomedia.merchanthub.controller;

import com.infomedia.merchanthub.platform.PlatformBindings;
import com.infomedia.merchanthub.service.merchant.MerchantRoleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Served inside the tenant context of the request's host.
 */
@RestController
@Tag(name = "Merchant Role", description = "Roles of the merchant's tenant")
@RequestMapping("/api/v1/merchant/roles")
public class MerchantRoleController {

    @Operation(summary = "List the public roles of the tenant with their permissions")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<?> find(@Parameter(hidden = true) @RequestAttribute(PlatformBindings.REQUEST_ATTRIBUTE) PlatformBindings bindings) {
        return bindings.get(MerchantRoleService.class).listRoles();
    }
}
