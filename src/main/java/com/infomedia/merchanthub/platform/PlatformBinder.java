package com.infomedia.merchanthub.platform;

import com.infomedia.merchanthub.exception.NoImplementationFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.stereotype.Component;

/**
 * Binds an abstract contract to the single implementation registered for the resolved platform.
 * Stateless; callers that want one instance per request go through {@link PlatformBindings}.
 */
@Component
@RequiredArgsConstructor
@Log4j2
public class PlatformBinder {

    private final PlatformBindingRegistry registry;
    private final BeanFactory beanFactory;

    public <T> T bind(Class<T> contract, ResolvedPlatform resolved) {
        return bind(contract, resolved.version(), resolved.platform());
    }

    public <T> T bind(Class<T> contract, int version, Platform platform) {
        for (PlatformCandidate<T> candidate : registry.implementationsFor(version, contract)) {
            if (candidate.platform() == platform) {
                return contract.cast(beanFactory.getBean(candidate.implementation()));
            }
        }
        NoImplementationFoundException exception = new NoImplementationFoundException(contract, version, platform);
        log.error(exception.getMessage());
        throw exception;
    }
}
