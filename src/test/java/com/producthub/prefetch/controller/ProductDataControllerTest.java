package com.producthub.prefetch.controller;

import com.producthub.prefetch.exception.FetchFailureException;
import com.producthub.prefetch.service.ProductDataService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * 产品中心数据控制器测试
 */
@WebMvcTest(ProductDataController.class)
class ProductDataControllerTest {
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private ProductDataService productDataService;
    
    @Test
    @DisplayName("读取数据 - 查询参数透传")
    void testRead() throws Exception {
        when(productDataService.read(eq("forms"), eq("all"), anyMap()))
            .thenReturn(List.of(Map.of("id", "f1")));
        
        mockMvc.perform(get("/api/data/forms/all").param("state", "TX"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(0))
            .andExpect(jsonPath("$.data[0].id").value("f1"));
        
        verify(productDataService).read("forms", "all", Map.of("state", "TX"));
    }
    
    @Test
    @DisplayName("数据不存在 - 404")
    void testNotFound() throws Exception {
        mockMvc.perform(get("/api/data/coverages/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }
    
    @Test
    @DisplayName("数据源异常 - 500")
    void testFetchFailure() throws Exception {
        when(productDataService.read(eq("rules"), eq("all"), anyMap()))
            .thenThrow(new FetchFailureException("rules", "all", new IllegalStateException("db down")));
        
        mockMvc.perform(get("/api/data/rules/all"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(500));
    }
}
