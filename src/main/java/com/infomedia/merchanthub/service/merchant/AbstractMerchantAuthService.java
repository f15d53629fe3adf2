package com.infomedia.merchanthub.service.merchant;

import com.infomedia.merchanthub.dto.auth.SignUpResponse;
import com.infomedia.merchanthub.multitenancy.CreateTenantCommand;
import com.infomedia.merchanthub.multitenancy.TenantCreationResult;
import com.infomedia.merchanthub.multitenancy.TenantLifecycleService;
import lombok.extern.log4j.Log4j2;

@Log4j2
public abstract class AbstractMerchantAuthService implements MerchantAuthService {

    private final TenantLifecycleService lifecycleService;

    protected AbstractMerchantAuthService(TenantLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Override
    public SignUpResponse signUp(SignUpCommand command) {
        log.info("Merchant sign-up for {} from {}", command.merchantDomain(), platform().getTag());
        TenantCreationResult result = lifecycleService.createTenant(new CreateTenantCommand(
                command.merchantName(),
                command.merchantDescription(),
                command.merchantDomain(),
                command.owner()
        ));
        return new SignUpResponse(platform().getTag(), result.tenant(), result.user());
    }
}
