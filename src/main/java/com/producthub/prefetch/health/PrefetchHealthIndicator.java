package com.producthub.prefetch.health;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.producthub.prefetch.model.EngineState;
import com.producthub.prefetch.model.PrefetchStats;
import com.producthub.prefetch.service.DataPrefetchEngine;
import com.producthub.prefetch.store.CaffeineCacheStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * 预取引擎健康检查，仅在未初始化时为 DOWN
 */
@Component("prefetchHealthIndicator")
@RequiredArgsConstructor
public class PrefetchHealthIndicator implements HealthIndicator {
    
    private final DataPrefetchEngine engine;
    private final CaffeineCacheStore cacheStore;
    
    @Override
    public Health health() {
        EngineState state = engine.getState();
        PrefetchStats stats = engine.getStats();
        CacheStats cacheStats = cacheStore.stats();
        Health.Builder builder = state == EngineState.UNINITIALIZED ? Health.down() : Health.up();
        return builder
            .withDetail("state", state)
            .withDetail("routeTransitions", stats.routeTransitionCount())
            .withDetail("behaviorPatterns", stats.behaviorPatternCount())
            .withDetail("componentStats", stats.componentStatCount())
            .withDetail("queueSize", stats.prefetchQueueSize())
            .withDetail("inProgress", stats.prefetchInProgressCount())
            .withDetail("cacheSize", cacheStore.size())
            .withDetail("cacheHitRate", cacheStats.hitRate())
            .withDetail("cacheEvictions", cacheStats.evictionCount())
            .build();
    }
}
