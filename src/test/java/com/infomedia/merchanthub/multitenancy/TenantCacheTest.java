package com.infomedia.merchanthub.multitenancy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TenantCacheTest {

    private static final String TENANT_A = "6f1c2a4e-0d1b-4c55-9a3e-2f7b1e9c0a11";
    private static final String TENANT_B = "0b9e7d3c-58a2-4f61-b0c4-7e2d9a1f3b22";

    private final TenantContextManager contextManager =
            new TenantContextManager(new TenantResourceResolver(new TenancyProperties()));
    private final TenantCacheKeyGenerator keyGenerator = new TenantCacheKeyGenerator();

    private ConcurrentMapCacheManager cacheManager;

    static class RoleLookup {
        public String find(String name) {
            return name;
        }
    }

    @BeforeEach
    void setUp() {
        cacheManager = new ConcurrentMapCacheManager("merchant-roles");
    }

    @AfterEach
    void tearDown() {
        TenantContext.clear();
    }

    @Test
    void sameCallUnderTwoTenantsGetsTwoKeys() throws Exception {
        Method method = RoleLookup.class.getMethod("find", String.class);
        RoleLookup target = new RoleLookup();

        Object keyA = contextManager.runInTenantContext(TENANT_A, () -> keyGenerator.generate(target, method, "admin"));
        Object keyB = contextManager.runInTenantContext(TENANT_B, () -> keyGenerator.generate(target, method, "admin"));

        assertThat(keyA).isNotEqualTo(keyB);
        assertThat(keyA.toString())
                .startsWith("tenant:6f1c2a4e0d1b4c559a3e2f7b1e9c0a11:")
                .endsWith("RoleLookup.find[admin]");
    }

    @Test
    void centralCallsGetTheCentralNamespace() throws Exception {
        Method method = RoleLookup.class.getMethod("find", String.class);

        assertThat(keyGenerator.generate(new RoleLookup(), method, "admin").toString())
                .isEqualTo(TenantCacheKeyGenerator.CENTRAL_NAMESPACE + "RoleLookup.find[admin]");
    }

    @Test
    void evictsOnlyTheEntriesOfOneNamespace() {
        Cache cache = cacheManager.getCache("merchant-roles");
        cache.put("tenant:aaa:RoleLookup.find[admin]", "a1");
        cache.put("tenant:aaa:RoleLookup.find[viewer]", "a2");
        cache.put("tenant:bbb:RoleLookup.find[admin]", "b1");

        int evicted = new TenantCacheEvictor(cacheManager).evict("tenant:aaa:");

        assertThat(evicted).isEqualTo(2);
        assertThat(cache.get("tenant:aaa:RoleLookup.find[admin]")).isNull();
        assertThat(cache.get("tenant:bbb:RoleLookup.find[admin]")).isNotNull();
    }

    @Test
    void cachesThatCannotBeEnumeratedAreCleared() {
        CacheManager manager = mock(CacheManager.class);
        Cache cache = mock(Cache.class);
        when(manager.getCacheNames()).thenReturn(java.util.List.of("remote"));
        when(manager.getCache("remote")).thenReturn(cache);
        when(cache.getNativeCache()).thenReturn(new Object());

        new TenantCacheEvictor(manager).evict("tenant:aaa:");

        verify(cache).clear();
    }
}
