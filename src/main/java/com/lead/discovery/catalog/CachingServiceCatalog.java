package com.lead.discovery.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lead.discovery.cache.CacheConfig;
import com.lead.discovery.cache.CacheStats;
import com.lead.discovery.core.model.ServiceOffering;
import com.lead.discovery.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Caffeine read-through cache in front of a {@link ServiceCatalog}. Entries expire after the
 * configured TTL; the delegate stays the source of truth.
 */
public class CachingServiceCatalog implements ServiceCatalog {
    private static final Logger log = LoggerFactory.getLogger(CachingServiceCatalog.class);

    private static final String ACTIVE_KEY = "__active__";

    private final ServiceCatalog delegate;
    private final MetricsService metricsService;
    private final Cache<String, Optional<ServiceOffering>> byId;
    private final Cache<String, List<ServiceOffering>> active;

    public CachingServiceCatalog(ServiceCatalog delegate, CacheConfig config, MetricsService metricsService) {
        this.delegate = delegate;
        this.metricsService = metricsService;
        this.byId = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        this.active = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .build();
        log.info("CachingServiceCatalog initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<ServiceOffering> findById(String serviceId) {
        Optional<ServiceOffering> cached = byId.getIfPresent(serviceId);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        Optional<ServiceOffering> loaded = delegate.findById(serviceId);
        byId.put(serviceId, loaded);
        return loaded;
    }

    @Override
    public List<ServiceOffering> findActive() {
        List<ServiceOffering> cached = active.getIfPresent(ACTIVE_KEY);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        List<ServiceOffering> loaded = List.copyOf(delegate.findActive());
        active.put(ACTIVE_KEY, loaded);
        return loaded;
    }

    public void invalidate(String serviceId) {
        byId.invalidate(serviceId);
        active.invalidateAll();
        log.debug("Invalidated catalog cache for service {}", serviceId);
    }

    public void invalidateAll() {
        byId.invalidateAll();
        active.invalidateAll();
        log.debug("Invalidated all catalog cache entries");
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = byId.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                byId.estimatedSize()
        );
    }
}
