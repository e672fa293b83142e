package com.producthub.prefetch.service;

import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.exception.FetchFailureException;
import com.producthub.prefetch.model.DataRequirement;
import com.producthub.prefetch.model.PrefetchOutcome;
import com.producthub.prefetch.store.CacheStore;
import com.producthub.prefetch.store.DataFetcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 缓存桥接：查缓存 -> 未命中则拉取 -> 以短 TTL 写入
 * 
 * 已有缓存一律跳过，不覆盖也不刷新，新鲜度由缓存自身策略负责。
 * 预取数据在被真实读取确认前视为临时数据，TTL 短于正常写入。
 */
@Slf4j
@Service
public class CacheBridge {
    
    private final CacheStore cacheStore;
    private final DataFetcher dataFetcher;
    private final PrefetchProperties properties;
    
    private final Map<PrefetchOutcome, Counter> outcomeCounters = new EnumMap<>(PrefetchOutcome.class);
    
    public CacheBridge(CacheStore cacheStore,
                       DataFetcher dataFetcher,
                       PrefetchProperties properties,
                       MeterRegistry meterRegistry) {
        this.cacheStore = cacheStore;
        this.dataFetcher = dataFetcher;
        this.properties = properties;
        for (PrefetchOutcome outcome : PrefetchOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("prefetch.requirements")
                .description("Prefetch requirement outcomes")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry));
        }
    }
    
    /**
     * 处理单条数据需求，不抛异常
     */
    public PrefetchOutcome fetchAndCache(DataRequirement requirement) {
        PrefetchOutcome outcome;
        try {
            outcome = doFetchAndCache(requirement);
        } catch (FetchFailureException e) {
            log.warn("Prefetch fetch failed: {}", e.getMessage(), e.getCause());
            outcome = PrefetchOutcome.FAILED;
        } catch (RuntimeException e) {
            log.warn("Prefetch failed for {}", requirement.dataKey(), e);
            outcome = PrefetchOutcome.FAILED;
        }
        outcomeCounters.get(outcome).increment();
        return outcome;
    }
    
    /**
     * 逐条独立处理，单条失败不影响其余
     */
    public Map<PrefetchOutcome, Integer> fetchAndCacheAll(List<DataRequirement> requirements) {
        Map<PrefetchOutcome, Integer> summary = new EnumMap<>(PrefetchOutcome.class);
        for (DataRequirement requirement : requirements) {
            summary.merge(fetchAndCache(requirement), 1, Integer::sum);
        }
        return summary;
    }
    
    private PrefetchOutcome doFetchAndCache(DataRequirement requirement) {
        String category = requirement.category();
        String identifier = requirement.identifier();
        Map<String, Object> params = requirement.params();
        
        if (cacheStore.get(category, identifier, params) != null) {
            log.debug("Prefetch skipped, already cached: {}", requirement.dataKey());
            return PrefetchOutcome.CACHE_HIT;
        }
        
        Object data = dataFetcher.fetch(category, identifier, params);
        if (data == null) {
            return PrefetchOutcome.EMPTY;
        }
        
        cacheStore.set(category, identifier, data, params, Duration.ofMillis(properties.getMaxPrefetchAgeMs()));
        log.debug("Prefetched {}", requirement.dataKey());
        return PrefetchOutcome.PREFETCHED;
    }
    
    public double outcomeCount(PrefetchOutcome outcome) {
        return outcomeCounters.get(outcome).count();
    }
}
