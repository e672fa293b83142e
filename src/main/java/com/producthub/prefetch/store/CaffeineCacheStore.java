package com.producthub.prefetch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 基于 Caffeine 的缓存存储
 * Key 格式：category:identifier[:k1:v1|k2:v2]，参数按名称排序保证同一请求得到同一 Key
 */
@Slf4j
@Component
public class CaffeineCacheStore implements CacheStore {
    
    private final Cache<String, CacheEntry> cache;
    private final ObjectMapper objectMapper;
    
    public CaffeineCacheStore(@Qualifier("productHubCache") Cache<String, CacheEntry> cache,
                              ObjectMapper objectMapper) {
        this.cache = cache;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public Object get(String category, String identifier, Map<String, Object> params) {
        CacheEntry entry = cache.getIfPresent(cacheKey(category, identifier, params));
        return entry != null ? entry.value() : null;
    }
    
    @Override
    public void set(String category, String identifier, Object value, Map<String, Object> params, Duration ttl) {
        if (value == null) {
            return;
        }
        String key = cacheKey(category, identifier, params);
        cache.put(key, new CacheEntry(value, ttl.toNanos()));
        log.debug("Cache set: key={}, ttl={}ms", key, ttl.toMillis());
    }
    
    public void clear() {
        cache.invalidateAll();
        log.info("Product hub cache cleared");
    }
    
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
    
    public CacheStats stats() {
        return cache.stats();
    }
    
    String cacheKey(String category, String identifier, Map<String, Object> params) {
        String base = category + ":" + identifier;
        if (params == null || params.isEmpty()) {
            return base;
        }
        String paramString = new TreeMap<>(params).entrySet().stream()
            .map(e -> e.getKey() + ":" + toJson(e.getValue()))
            .collect(Collectors.joining("|"));
        return base + ":" + paramString;
    }
    
    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Param not serializable, using toString: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }
}
