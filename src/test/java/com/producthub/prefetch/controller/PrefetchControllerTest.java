package com.producthub.prefetch.controller;

import com.producthub.prefetch.model.CandidateType;
import com.producthub.prefetch.model.DataRequirement;
import com.producthub.prefetch.model.EngineState;
import com.producthub.prefetch.model.PrefetchCandidate;
import com.producthub.prefetch.model.PrefetchStats;
import com.producthub.prefetch.service.DataPrefetchEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 预取引擎控制器测试
 */
@WebMvcTest(PrefetchController.class)
class PrefetchControllerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private DataPrefetchEngine engine;
    
    @Test
    @DisplayName("上报路由跳转")
    void testRouteChange() throws Exception {
        mockMvc.perform(post("/api/prefetch/events/route")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fromRoute\":\"/products\",\"toRoute\":\"/coverage\",\"timeSpentMs\":1200}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.code").value(0));
        
        verify(engine).onRouteChange("/products", "/coverage", 1200L);
    }
    
    @Test
    @DisplayName("上报导航")
    void testNavigation() throws Exception {
        mockMvc.perform(post("/api/prefetch/events/navigation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"route\":\"/pricing\"}"))
            .andExpect(status().isAccepted());
        
        verify(engine).onNavigation("/pricing");
    }
    
    @Test
    @DisplayName("上报交互 - 原样转交载荷")
    void testInteraction() throws Exception {
        String payload = "{\"type\":\"button\",\"identifier\":\"view\"}";
        
        mockMvc.perform(post("/api/prefetch/events/interaction")
                .contentType(MediaType.TEXT_PLAIN)
                .content(payload))
            .andExpect(status().isAccepted());
        
        verify(engine).onComponentInteraction(payload);
    }
    
    @Test
    @DisplayName("上报数据访问")
    void testDataAccess() throws Exception {
        mockMvc.perform(post("/api/prefetch/events/data-access")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\":\"forms\",\"identifier\":\"all\",\"params\":{\"limit\":5}}"))
            .andExpect(status().isAccepted());
        
        verify(engine).onDataAccess(eq("forms"), eq("all"), eq(Map.of("limit", 5)));
    }
    
    @Test
    @DisplayName("请求体非法 - 400")
    void testUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/prefetch/events/route")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{broken"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400));
        
        verifyNoInteractions(engine);
    }
    
    @Test
    @DisplayName("预测预览")
    void testPredictions() throws Exception {
        when(engine.previewPredictions("/products")).thenReturn(List.of(new PrefetchCandidate(
            CandidateType.ROUTE, "/coverage", 0.9, List.of(DataRequirement.of("coverages", "all")))));
        
        mockMvc.perform(get("/api/prefetch/predictions").param("route", "/products"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].type").value("route"))
            .andExpect(jsonPath("$.data[0].target").value("/coverage"))
            .andExpect(jsonPath("$.data[0].confidence").value(0.9))
            .andExpect(jsonPath("$.data[0].dataRequirements[0].category").value("coverages"));
    }
    
    @Test
    @DisplayName("预测预览缺少路由参数 - 400")
    void testPredictionsMissingRoute() throws Exception {
        mockMvc.perform(get("/api/prefetch/predictions"))
            .andExpect(status().isBadRequest());
    }
    
    @Test
    @DisplayName("统计与状态")
    void testStatsAndState() throws Exception {
        when(engine.getStats()).thenReturn(new PrefetchStats(2, 3, 1, 4, 1, 17));
        when(engine.getState()).thenReturn(EngineState.RUNNING);
        
        mockMvc.perform(get("/api/prefetch/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.routeTransitionCount").value(2))
            .andExpect(jsonPath("$.data.prefetchQueueSize").value(4))
            .andExpect(jsonPath("$.data.totalObservedAccesses").value(17));
        
        mockMvc.perform(get("/api/prefetch/state"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value("RUNNING"));
    }
    
    @Test
    @DisplayName("重置")
    void testReset() throws Exception {
        mockMvc.perform(delete("/api/prefetch/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0));
        
        verify(engine).reset();
    }
}
