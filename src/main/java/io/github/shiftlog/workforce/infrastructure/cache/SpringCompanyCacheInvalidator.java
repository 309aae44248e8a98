package io.github.shiftlog.workforce.infrastructure.cache;

import io.github.shiftlog.workforce.application.cache.CompanyCacheInvalidator;
import io.github.shiftlog.workforce.config.CacheConfig;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

@Component
public class SpringCompanyCacheInvalidator implements CompanyCacheInvalidator {

    private final CacheManager cacheManager;

    public SpringCompanyCacheInvalidator(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    @Override
    public void invalidate(Long companyId) {
        Cache cache = cacheManager.getCache(CacheConfig.COMPANY_STATS);
        if (cache != null) {
            cache.evict(companyId);
        }
    }
}
