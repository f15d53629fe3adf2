package com.infomedia.merchanthub.platform;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Static table of (api version, contract) to the ordered list of platform specific implementations.
 * Filled once at startup; lookups never fail, an unknown pair yields an empty list.
 */
@Log4j2
public class PlatformBindingRegistry {

    private final Map<BindingKey, List<PlatformCandidate<?>>> bindings = new ConcurrentHashMap<>();

    public <T> PlatformBindingRegistry register(int version, Class<T> contract,
                                                Class<? extends T> implementation, Platform platform) {
        if (!contract.isAssignableFrom(implementation)) {
            throw new IllegalArgumentException(implementation.getName() + " does not implement " + contract.getName());
        }

        List<PlatformCandidate<?>> candidates = bindings.computeIfAbsent(new BindingKey(version, contract),
                k -> new CopyOnWriteArrayList<>());

        synchronized (candidates) {
            for (PlatformCandidate<?> existing : candidates) {
                if (existing.platform() == platform) {
                    throw new IllegalStateException("Platform '" + platform.getTag() + "' already has an implementation of "
                            + contract.getName() + " for api v" + version + ": " + existing.implementation().getName());
                }
            }
            candidates.add(new PlatformCandidate<T>(implementation, platform));
        }

        log.debug("Registered {} -> {} [v{}, {}]", contract.getSimpleName(), implementation.getSimpleName(),
                version, platform.getTag());
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> List<PlatformCandidate<T>> implementationsFor(int version, Class<T> contract) {
        List<PlatformCandidate<?>> candidates = bindings.get(new BindingKey(version, contract));
        if (candidates == null) {
            return Collections.emptyList();
        }
        List<PlatformCandidate<T>> result = new ArrayList<>(candidates.size());
        candidates.forEach(candidate -> result.add((PlatformCandidate<T>) candidate));
        return Collections.unmodifiableList(result);
    }

    private record BindingKey(int version, Class<?> contract) {
    }
}
