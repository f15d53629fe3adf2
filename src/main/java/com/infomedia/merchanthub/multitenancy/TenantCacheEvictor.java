package com.infomedia.merchanthub.multitenancy;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentMap;

/**
 * Drops the cache entries written under one tenant's namespace.
 */
@Component
@RequiredArgsConstructor
@Log4j2
public class TenantCacheEvictor {

    private final CacheManager cacheManager;

    public int evict(String cacheNamespace) {
        int evicted = 0;
        for (String cacheName : cacheManager.getCacheNames()) {
            Cache cache = cacheManager.getCache(cacheName);
            if (cache == null) {
                continue;
            }
            if (cache.getNativeCache() instanceof ConcurrentMap<?, ?> entries) {
                int before = entries.size();
                entries.keySet().removeIf(key -> key.toString().startsWith(cacheNamespace));
                evicted += before - entries.size();
            } else {
                // Keys of other providers cannot be enumerated
                log.warn("Clearing cache {} entirely to evict namespace {}", cacheName, cacheNamespace);
                cache.clear();
            }
        }
        log.debug("Evicted {} cache entries of namespace {}", evicted, cacheNamespace);
        return evicted;
    }
}
