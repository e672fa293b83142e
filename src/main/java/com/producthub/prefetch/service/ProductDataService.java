package com.producthub.prefetch.service;

import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.event.DataAccessEvent;
import com.producthub.prefetch.store.CacheStore;
import com.producthub.prefetch.store.DataFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * 产品中心数据读取（读穿缓存）
 * 每次读取都会发布 DataAccessEvent，供预取引擎学习访问模式
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductDataService {
    
    private final CacheStore cacheStore;
    private final DataFetcher dataFetcher;
    private final PrefetchProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    
    /**
     * 读取数据：缓存命中直接返回，否则回源并以正常 TTL 写入缓存
     * 数据源异常向调用方传播
     */
    public Object read(String category, String identifier, Map<String, Object> params) {
        Map<String, Object> safeParams = params == null ? Map.of() : params;
        eventPublisher.publishEvent(new DataAccessEvent(category, identifier, safeParams));
        
        Object cached = cacheStore.get(category, identifier, safeParams);
        if (cached != null) {
            return cached;
        }
        
        Object data = dataFetcher.fetch(category, identifier, safeParams);
        if (data != null) {
            cacheStore.set(category, identifier, data, safeParams,
                Duration.ofMillis(properties.getCacheStore().getDefaultTtlMs()));
            log.debug("Loaded from source: {}:{}", category, identifier);
        }
        return data;
    }
}
