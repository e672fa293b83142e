package com.producthub.prefetch.store;

/**
 * 缓存条目，携带自身 TTL
 */
public record CacheEntry(Object value, long ttlNanos) {}
