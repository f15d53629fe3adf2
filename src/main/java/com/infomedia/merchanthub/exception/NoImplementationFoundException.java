package com.infomedia.merchanthub.exception;

import com.infomedia.merchanthub.platform.Platform;
import lombok.Getter;

/**
 * No concrete implementation is registered for a contract on the resolved platform.
 * Always a configuration defect, never retried.
 */
@Getter
public class NoImplementationFoundException extends RuntimeException {

    private final Class<?> contract;
    private final int version;
    private final Platform platform;

    public NoImplementationFoundException(Class<?> contract, int version, Platform platform) {
        super("No implementation found for " + contract.getName() + " on platform '" + platform.getTag()
                + "' (api v" + version + ")");
        this.contract = contract;
        this.version = version;
        this.platform = platform;
    }
}
