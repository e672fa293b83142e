package com.producthub.prefetch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.producthub.prefetch.config.JacksonConfig;
import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.constant.PrefetchConstants;
import com.producthub.prefetch.exception.PersistenceException;
import com.producthub.prefetch.model.PatternSnapshot;
import com.producthub.prefetch.store.DurableStore;
import com.producthub.prefetch.store.InMemoryDurableStore;
import com.producthub.prefetch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 行为模式持久化单元测试
 */
class PatternPersistenceTest {
    
    private MutableClock clock;
    private PrefetchProperties properties;
    private ObjectMapper objectMapper;
    private InMemoryDurableStore durableStore;
    private BehaviorTracker tracker;
    private PatternPersistence persistence;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        properties = new PrefetchProperties();
        objectMapper = JacksonConfig.configure(new ObjectMapper());
        durableStore = new InMemoryDurableStore();
        tracker = new BehaviorTracker(properties, clock, objectMapper);
        persistence = new PatternPersistence(tracker, durableStore, objectMapper, properties, clock);
    }
    
    @Test
    @DisplayName("无快照 - 冷启动")
    void testLoadWithoutSnapshot() {
        assertFalse(persistence.load());
    }
    
    @Test
    @DisplayName("保存后在新实例中恢复全部统计")
    void testSaveAndRestore() {
        recordActivity();
        PatternSnapshot before = tracker.snapshot();
        assertTrue(persistence.save());
        
        BehaviorTracker restored = new BehaviorTracker(properties, clock, objectMapper);
        PatternPersistence reloaded = new PatternPersistence(restored, durableStore, objectMapper, properties, clock);
        clock.advanceMillis(properties.getMaxPatternAgeMs() - 1);
        
        assertTrue(reloaded.load());
        PatternSnapshot after = restored.snapshot();
        assertEquals(before.getRouteTransitions(), after.getRouteTransitions());
        assertEquals(before.getUserBehaviorPatterns(), after.getUserBehaviorPatterns());
        assertEquals(before.getComponentUsageStats(), after.getComponentUsageStats());
    }
    
    @Test
    @DisplayName("快照过期 - 丢弃并冷启动")
    void testStaleSnapshotDiscarded() {
        recordActivity();
        persistence.save();
        
        BehaviorTracker fresh = new BehaviorTracker(properties, clock, objectMapper);
        PatternPersistence reloaded = new PatternPersistence(fresh, durableStore, objectMapper, properties, clock);
        clock.advanceMillis(properties.getMaxPatternAgeMs() + 1);
        
        assertFalse(reloaded.load());
        assertEquals(0, fresh.routeTransitionCount());
        assertEquals(0, fresh.behaviorPatternCount());
    }
    
    @Test
    @DisplayName("快照内容损坏 - 冷启动")
    void testCorruptSnapshot() {
        durableStore.setItem(PrefetchConstants.SNAPSHOT_KEY, "{broken");
        assertFalse(persistence.load());
    }
    
    @Test
    @DisplayName("快照使用固定 Key 与约定字段名")
    void testSnapshotFormat() throws Exception {
        recordActivity();
        persistence.save();
        
        String json = durableStore.getItem(PrefetchConstants.SNAPSHOT_KEY);
        Map<?, ?> root = objectMapper.readValue(json, Map.class);
        assertTrue(root.containsKey("routeTransitions"));
        assertTrue(root.containsKey("userBehaviorPatterns"));
        assertTrue(root.containsKey("componentUsageStats"));
        assertEquals(clock.millis(), ((Number) root.get("timestamp")).longValue());
    }
    
    @Test
    @DisplayName("存储不可用 - 不抛异常")
    void testStoreUnavailable() {
        DurableStore broken = mock(DurableStore.class);
        doThrow(new PersistenceException("redis down", null)).when(broken).setItem(anyString(), anyString());
        when(broken.getItem(anyString())).thenThrow(new PersistenceException("redis down", null));
        PatternPersistence failing = new PatternPersistence(tracker, broken, objectMapper, properties, clock);
        
        assertFalse(failing.save());
        assertFalse(failing.load());
    }
    
    @Test
    @DisplayName("删除快照")
    void testDelete() {
        recordActivity();
        persistence.save();
        
        persistence.delete();
        
        assertNull(durableStore.getItem(PrefetchConstants.SNAPSHOT_KEY));
        assertFalse(persistence.load());
    }
    
    private void recordActivity() {
        tracker.recordRouteTransition("/products", "/coverage", 1500);
        tracker.recordDataAccess("products", "p1", Map.of("limit", 10));
        tracker.recordDataAccess("coverages", "c1", Map.of());
        tracker.recordComponentInteraction("{\"type\":\"button\",\"identifier\":\"view\","
            + "\"prefetchTargets\":[{\"category\":\"forms\",\"identifier\":\"all\",\"params\":{\"state\":\"TX\"}}]}");
    }
}
