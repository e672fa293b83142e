package com.producthub.prefetch.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.producthub.prefetch.config.CaffeineConfig;
import com.producthub.prefetch.config.JacksonConfig;
import com.producthub.prefetch.model.EngineState;
import com.producthub.prefetch.model.PrefetchStats;
import com.producthub.prefetch.service.DataPrefetchEngine;
import com.producthub.prefetch.store.CacheEntry;
import com.producthub.prefetch.store.CaffeineCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * 预取引擎健康检查测试
 */
@ExtendWith(MockitoExtension.class)
class PrefetchHealthIndicatorTest {
    
    @Mock
    private DataPrefetchEngine engine;
    
    private CaffeineCacheStore cacheStore;
    private PrefetchHealthIndicator healthIndicator;
    
    @BeforeEach
    void setUp() {
        Cache<String, CacheEntry> cache = Caffeine.newBuilder()
            .maximumSize(100)
            .expireAfter(CaffeineConfig.perEntryExpiry())
            .recordStats()
            .executor(Runnable::run)
            .build();
        cacheStore = new CaffeineCacheStore(cache, JacksonConfig.configure(new ObjectMapper()));
        healthIndicator = new PrefetchHealthIndicator(engine, cacheStore);
        when(engine.getStats()).thenReturn(new PrefetchStats(1, 2, 0, 0, 0, 5));
    }
    
    @Test
    @DisplayName("未初始化 - DOWN")
    void testDownWhenUninitialized() {
        when(engine.getState()).thenReturn(EngineState.UNINITIALIZED);
        
        assertEquals(Status.DOWN, healthIndicator.health().getStatus());
    }
    
    @Test
    @DisplayName("运行中 - UP 并带缓存命中率")
    void testUpWithCacheStats() {
        when(engine.getState()).thenReturn(EngineState.RUNNING);
        cacheStore.set("products", "all", List.of("p1"), Map.of(), Duration.ofMinutes(5));
        cacheStore.get("products", "all", Map.of());
        cacheStore.get("coverages", "all", Map.of());
        
        Health health = healthIndicator.health();
        
        assertEquals(Status.UP, health.getStatus());
        assertEquals(EngineState.RUNNING, health.getDetails().get("state"));
        assertEquals(1L, health.getDetails().get("cacheSize"));
        assertEquals(0.5, (Double) health.getDetails().get("cacheHitRate"), 1e-9);
        assertEquals(2, health.getDetails().get("behaviorPatterns"));
    }
}
