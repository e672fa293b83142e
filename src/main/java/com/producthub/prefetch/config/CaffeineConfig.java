package com.producthub.prefetch.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.producthub.prefetch.store.CacheEntry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine 本地缓存配置
 * 每个条目自带 TTL：预取写入 10 分钟，正常读取写入 5 分钟（可配置）
 */
@Configuration
public class CaffeineConfig {
    
    private static final Logger log = LoggerFactory.getLogger(CaffeineConfig.class);

    /**
     * 业务数据缓存（按条目过期）
     */
    @Bean("productHubCache")
    public Cache<String, CacheEntry> productHubCache(PrefetchProperties properties, MeterRegistry meterRegistry) {
        PrefetchProperties.CacheStoreConfig config = properties.getCacheStore();
        Caffeine<String, CacheEntry> builder = Caffeine.newBuilder()
            .maximumSize(config.getMaximumSize())
            .expireAfter(perEntryExpiry())
            .removalListener((String key, CacheEntry value, RemovalCause cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Cache evicted due to size: key={}", key);
                } else if (cause == RemovalCause.EXPIRED) {
                    log.debug("Cache expired: key={}", key);
                }
            });
        
        if (config.isRecordStats()) {
            builder.recordStats();
        }
        
        Cache<String, CacheEntry> cache = builder.build();
        CaffeineCacheMetrics.monitor(meterRegistry, cache, "product_hub_cache");
        
        log.info("Product hub cache initialized: maximumSize={}, defaultTtl={}ms",
            config.getMaximumSize(), config.getDefaultTtlMs());
        return cache;
    }
    
    /**
     * 写入（创建或覆盖）时以条目自身 TTL 为准，读取不续期
     */
    public static Expiry<String, CacheEntry> perEntryExpiry() {
        return new Expiry<>() {
            @Override
            public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
                return value.ttlNanos();
            }

            @Override
            public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
                return value.ttlNanos();
            }

            @Override
            public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
                return currentDuration;
            }
        };
    }
}
