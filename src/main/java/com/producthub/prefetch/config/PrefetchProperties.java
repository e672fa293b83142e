package com.producthub.prefetch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 预取引擎配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "prefetch")
public class PrefetchProperties {
    
    /** 是否启用预取 */
    private boolean enabled = true;
    
    /** 最大并发预取数 */
    private int maxConcurrentPrefetch = 3;
    
    /** 交互触发预取前的延迟（毫秒） */
    private long prefetchDelayMs = 1000;
    
    /** 行为统计窗口（毫秒），默认 30 分钟 */
    private long behaviorTrackingWindowMs = 1_800_000L;
    
    /** 触发预取的最小置信度 */
    private double minConfidenceScore = 0.6;
    
    /** 预取数据的缓存 TTL（毫秒），默认 10 分钟 */
    private long maxPrefetchAgeMs = 600_000L;
    
    /** 预取队列处理间隔（毫秒） */
    private long tickIntervalMs = 2000;
    
    /** 持久化快照最大有效期（毫秒），默认 7 天 */
    private long maxPatternAgeMs = 604_800_000L;
    
    /** 预取工作线程数，0 表示与 maxConcurrentPrefetch 一致 */
    private int workerPoolSize = 0;
    
    /** 缓存存储配置 */
    private CacheStoreConfig cacheStore = new CacheStoreConfig();
    
    /** 持久化配置 */
    private PersistenceConfig persistence = new PersistenceConfig();
    
    public int effectiveWorkerPoolSize() {
        return workerPoolSize > 0 ? workerPoolSize : Math.max(1, maxConcurrentPrefetch);
    }
    
    @Data
    public static class CacheStoreConfig {
        /** 正常读取写入缓存的 TTL（毫秒），长于预取 TTL */
        private long defaultTtlMs = 300_000L;
        /** 最大条目数 */
        private long maximumSize = 10_000;
        /** 是否开启统计 */
        private boolean recordStats = true;
    }
    
    @Data
    public static class PersistenceConfig {
        /** 持久化存储类型：redis / memory */
        private String store = "redis";
    }
}
