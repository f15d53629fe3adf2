package com.infomedia.merchanthub.multitenancy;

import org.springframework.cache.interceptor.KeyGenerator;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Arrays;

/**
 * Prefixes every cache key with the cache namespace of the active tenant, so two tenants
 * calling the same cached method never share an entry.
 */
@Component(TenantCacheKeyGenerator.BEAN_NAME)
public class TenantCacheKeyGenerator implements KeyGenerator {

    public static final String BEAN_NAME = "tenantCacheKeyGenerator";

    static final String CENTRAL_NAMESPACE = "central:";

    @Override
    @NonNull
    public Object generate(@NonNull Object target, @NonNull Method method, @NonNull Object... params) {
        String namespace = TenantContext.current()
                .map(TenantResources::cacheNamespace)
                .orElse(CENTRAL_NAMESPACE);
        return namespace + target.getClass().getSimpleName() + "." + method.getName() + Arrays.deepToString(params);
    }
}
