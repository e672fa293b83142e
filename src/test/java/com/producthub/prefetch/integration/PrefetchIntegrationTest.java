package com.producthub.prefetch.integration;

import com.producthub.prefetch.entity.ProductHubDocument;
import com.producthub.prefetch.model.EngineState;
import com.producthub.prefetch.repository.ProductHubDocumentRepository;
import com.producthub.prefetch.service.DataPrefetchEngine;
import com.producthub.prefetch.service.PrefetchScheduler;
import com.producthub.prefetch.store.CaffeineCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 预取引擎集成测试：读取链路、事件学习、预取写缓存
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PrefetchIntegrationTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @Autowired
    private ProductHubDocumentRepository repository;
    
    @Autowired
    private DataPrefetchEngine engine;
    
    @Autowired
    private PrefetchScheduler scheduler;
    
    @Autowired
    private CaffeineCacheStore cacheStore;
    
    @BeforeEach
    void setUp() {
        engine.reset();
        cacheStore.clear();
        repository.deleteAll();
        save("products", "p1", "{\"name\":\"Auto\",\"state\":\"TX\"}");
        save("coverages", "c1", "{\"name\":\"Collision\"}");
        save("coverages", "c2", "{\"name\":\"Liability\"}");
        save("forms", "f1", "{\"name\":\"Declarations\"}");
    }
    
    @Test
    @DisplayName("应用就绪后引擎进入 RUNNING")
    void testEngineStarted() {
        assertEquals(EngineState.RUNNING, engine.getState());
    }
    
    @Test
    @DisplayName("读取集合与单个文档")
    void testReadData() throws Exception {
        mockMvc.perform(get("/api/data/coverages/all"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(2))
            .andExpect(jsonPath("$.data[0].id").value("c1"));
        
        mockMvc.perform(get("/api/data/coverages/c2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.name").value("Liability"));
        
        mockMvc.perform(get("/api/data/news/all"))
            .andExpect(status().isNotFound());
    }
    
    @Test
    @DisplayName("读取链路产生访问统计")
    void testReadFeedsBehaviorTracking() throws Exception {
        mockMvc.perform(get("/api/data/products/all")).andExpect(status().isOk());
        mockMvc.perform(get("/api/data/products/all")).andExpect(status().isOk());
        
        assertEquals(1, engine.getStats().behaviorPatternCount());
        assertEquals(2, engine.getStats().totalObservedAccesses());
    }
    
    @Test
    @DisplayName("参数过滤")
    void testReadWithFilter() throws Exception {
        mockMvc.perform(get("/api/data/products/all").param("state", "CA"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(0));
    }
    
    @Test
    @DisplayName("路由跳转学习后预取目标页面数据")
    void testRouteLearningPrefetchesIntoCache() throws Exception {
        for (int i = 0; i < 6; i++) {
            mockMvc.perform(post("/api/prefetch/events/route")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"fromRoute\":\"/products\",\"toRoute\":\"/coverage\",\"timeSpentMs\":1000}"))
                .andExpect(status().isAccepted());
        }
        mockMvc.perform(post("/api/prefetch/events/route")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fromRoute\":\"/forms\",\"toRoute\":\"/products\",\"timeSpentMs\":100}"))
            .andExpect(status().isAccepted());
        assertTrue(scheduler.isPending("route:/coverage"));
        
        scheduler.processTick();
        
        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.inProgressSize() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, scheduler.inProgressSize());
        assertNotNull(cacheStore.get("coverages", "all", Map.of()));
        assertNotNull(cacheStore.get("forms", "all", Map.of()));
    }
    
    @Test
    @DisplayName("统计与重置接口")
    void testStatsAndReset() throws Exception {
        mockMvc.perform(post("/api/prefetch/events/navigation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"route\":\"/products\"}"))
            .andExpect(status().isAccepted());
        mockMvc.perform(post("/api/prefetch/events/navigation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"route\":\"/pricing\"}"))
            .andExpect(status().isAccepted());
        
        mockMvc.perform(get("/api/prefetch/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.routeTransitionCount").value(1));
        
        mockMvc.perform(delete("/api/prefetch/reset")).andExpect(status().isOk());
        
        mockMvc.perform(get("/api/prefetch/stats"))
            .andExpect(jsonPath("$.data.routeTransitionCount").value(0));
    }
    
    @Test
    @DisplayName("健康检查")
    void testHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.prefetch.details.state").value("RUNNING"))
            .andExpect(jsonPath("$.components.prefetch.details.cacheHitRate").exists());
    }
    
    private void save(String collection, String id, String payload) {
        ProductHubDocument document = new ProductHubDocument();
        document.setCollectionName(collection);
        document.setDocumentId(id);
        document.setPayload(payload);
        repository.save(document);
    }
}
