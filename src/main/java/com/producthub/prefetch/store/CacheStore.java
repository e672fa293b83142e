package com.producthub.prefetch.store;

import java.time.Duration;
import java.util.Map;

/**
 * 缓存存储。预取引擎只是客户端，淘汰策略由实现负责
 */
public interface CacheStore {
    
    /**
     * @return 缓存值，未命中返回 null
     */
    Object get(String category, String identifier, Map<String, Object> params);
    
    void set(String category, String identifier, Object value, Map<String, Object> params, Duration ttl);
}
