package com.infomedia.merchanthub.controller;

import com.infomedia.merchanthub.dto.auth.PlatformDto;
import com.infomedia.merchanthub.dto.auth.SignUpRequest;
import com.infomedia.merchanthub.dto.auth.SignUpResponse;
import com.infomedia.merchanthub.platform.PlatformBindings;
import com.infomedia.merchanthub.platform.ResolvedPlatform;
import com.infomedia.merchanthub.service.merchant.MerchantAuthService;
import com.infomedia.merchanthub.service.merchant.SignUpCommand;
import com.infomedia.merchanthub.service.merchant.SignUpRequestResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Merchant Auth", description = "Merchant sign-up")
@RequestMapping("/api/v1/merchant/auth")
public class MerchantAuthController {

    @Operation(summary = "Create a merchant, its isolated tenant and its owner account")
    @PostMapping(value = "/sign-up", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public SignUpResponse signUp(@Parameter(hidden = true) @RequestAttribute(PlatformBindings.REQUEST_ATTRIBUTE) PlatformBindings bindings,
                                 @Valid @RequestBody SignUpRequest request) {
        SignUpCommand command = bindings.get(SignUpRequestResolver.class).resolve(request);
        return bindings.get(MerchantAuthService.class).signUp(command);
    }

    @Operation(summary = "Echo the platform the request was routed to")
    @GetMapping(value = "/platform", produces = MediaType.APPLICATION_JSON_VALUE)
    public PlatformDto whatIsMyPlatform(@Parameter(hidden = true) @RequestAttribute(PlatformBindings.REQUEST_ATTRIBUTE) PlatformBindings bindings) {
        ResolvedPlatform resolved = bindings.getResolved();
        return new PlatformDto(resolved.version(), resolved.platform().getTag(),
                bindings.get(MerchantAuthService.class).whatIsMyPlatform());
    }
}
