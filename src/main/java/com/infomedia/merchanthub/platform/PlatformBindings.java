package com.infomedia.merchanthub.platform;

import java.util.HashMap;
import java.util.Map;

/**
 * The contract bindings of one request. Created by {@link PlatformFilter} and stored as a
 * request attribute, so a binding never outlives the request that resolved it.
 */
public class PlatformBindings {

    public static final String REQUEST_ATTRIBUTE = "com.infomedia.merchanthub.platform.PlatformBindings";

    private final PlatformBinder binder;
    private final ResolvedPlatform resolved;
    private final Map<Class<?>, Object> bound = new HashMap<>();

    public PlatformBindings(PlatformBinder binder, ResolvedPlatform resolved) {
        this.binder = binder;
        this.resolved = resolved;
    }

    public ResolvedPlatform getResolved() {
        return resolved;
    }

    public <T> T get(Class<T> contract) {
        return contract.cast(bound.computeIfAbsent(contract, c -> binder.bind(contract, resolved)));
    }
}
