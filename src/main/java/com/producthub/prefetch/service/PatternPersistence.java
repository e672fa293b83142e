package com.producthub.prefetch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.constant.PrefetchConstants;
import com.producthub.prefetch.exception.PersistenceException;
import com.producthub.prefetch.model.PatternSnapshot;
import com.producthub.prefetch.store.DurableStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 行为模式持久化
 * 
 * 每次行为变更后整体写入一个固定 Key；加载时超过 maxPatternAge 的快照直接丢弃。
 * 存储不可用时只记录日志，引擎继续在内存中运行。
 * 
 * 取快照、写入、删除在同一把锁内完成，最后一次写入总是携带最新状态，
 * reset 之后不会有旧快照被写回。
 */
@Slf4j
@Service
public class PatternPersistence {
    
    private final BehaviorTracker behaviorTracker;
    private final DurableStore durableStore;
    private final ObjectMapper objectMapper;
    private final PrefetchProperties properties;
    private final Clock clock;
    
    private final Object monitor = new Object();
    
    public PatternPersistence(BehaviorTracker behaviorTracker,
                              DurableStore durableStore,
                              ObjectMapper objectMapper,
                              PrefetchProperties properties,
                              Clock clock) {
        this.behaviorTracker = behaviorTracker;
        this.durableStore = durableStore;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }
    
    /**
     * 写入当前快照
     * @return 是否写入成功
     */
    public boolean save() {
        synchronized (monitor) {
            try {
                PatternSnapshot snapshot = behaviorTracker.snapshot();
                durableStore.setItem(PrefetchConstants.SNAPSHOT_KEY, objectMapper.writeValueAsString(snapshot));
                return true;
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize behavior patterns: {}", e.getOriginalMessage());
            } catch (PersistenceException e) {
                log.warn("Failed to persist behavior patterns: {}", e.getMessage());
            }
            return false;
        }
    }
    
    /**
     * 读取快照并恢复
     * @return true 表示已恢复（WARM），false 表示冷启动
     */
    public boolean load() {
        String stored;
        try {
            stored = durableStore.getItem(PrefetchConstants.SNAPSHOT_KEY);
        } catch (PersistenceException e) {
            log.warn("Failed to read behavior patterns, starting cold: {}", e.getMessage());
            return false;
        }
        if (stored == null) {
            log.info("No stored behavior patterns, starting cold");
            return false;
        }
        
        PatternSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(stored, PatternSnapshot.class);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable behavior patterns: {}", e.getOriginalMessage());
            return false;
        }
        
        long age = clock.millis() - snapshot.getTimestamp();
        if (age > properties.getMaxPatternAgeMs()) {
            log.info("Discarding stale behavior patterns: age={}ms, max={}ms", age, properties.getMaxPatternAgeMs());
            return false;
        }
        
        behaviorTracker.restore(snapshot);
        log.info("Loaded historical behavior patterns: routes={}, patterns={}, interactions={}",
            snapshot.getRouteTransitions().size(),
            snapshot.getUserBehaviorPatterns().size(),
            snapshot.getComponentUsageStats().size());
        return true;
    }
    
    /**
     * 删除持久化快照
     */
    public void delete() {
        synchronized (monitor) {
            try {
                durableStore.removeItem(PrefetchConstants.SNAPSHOT_KEY);
            } catch (PersistenceException e) {
                log.warn("Failed to delete behavior patterns: {}", e.getMessage());
            }
        }
    }
    
    /**
     * 清空内存中的行为数据并删除持久化快照，期间不会有写入穿插
     */
    public void clearAll() {
        synchronized (monitor) {
            behaviorTracker.clear();
            delete();
        }
    }
}
