package com.infomedia.merchanthub.config;

import com.infomedia.merchanthub.service.merchant.MerchantRoleService;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * In-memory caches. Keys carry the tenant's cache namespace, see
 * {@link com.infomedia.merchanthub.multitenancy.TenantCacheKeyGenerator}.
 */
@Configuration
@EnableCaching
public class CachingConfig {

    @Bean
    public CacheManager cacheManager() {
        return new ConcurrentMapCacheManager(
                MerchantRoleService.CACHE_NAME
        );
    }
}
