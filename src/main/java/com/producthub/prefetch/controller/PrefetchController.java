package com.producthub.prefetch.controller;

import com.producthub.prefetch.dto.ApiResponse;
import com.producthub.prefetch.dto.DataAccessRequest;
import com.producthub.prefetch.dto.NavigationRequest;
import com.producthub.prefetch.dto.RouteChangeRequest;
import com.producthub.prefetch.model.EngineState;
import com.producthub.prefetch.model.PrefetchCandidate;
import com.producthub.prefetch.model.PrefetchStats;
import com.producthub.prefetch.service.DataPrefetchEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 预取引擎 API
 * 1. 行为事件上报（路由、导航、交互、数据访问）
 * 2. 预测预览
 * 3. 统计与重置
 */
@Slf4j
@RestController
@RequestMapping("/api/prefetch")
@RequiredArgsConstructor
public class PrefetchController {
    
    private final DataPrefetchEngine engine;
    
    /**
     * 路由跳转
     */
    @PostMapping("/events/route")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<Void> routeChange(@RequestBody RouteChangeRequest request) {
        engine.onRouteChange(request.getFromRoute(), request.getToRoute(), request.getTimeSpentMs());
        return ApiResponse.accepted();
    }
    
    /**
     * 导航（仅目标路由）
     */
    @PostMapping("/events/navigation")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<Void> navigation(@RequestBody NavigationRequest request) {
        engine.onNavigation(request.getRoute());
        return ApiResponse.accepted();
    }
    
    /**
     * 界面交互，请求体为原始 JSON 文本，非法载荷由引擎丢弃
     */
    @PostMapping(value = "/events/interaction", consumes = "*/*")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<Void> interaction(@RequestBody(required = false) String payload) {
        engine.onComponentInteraction(payload);
        return ApiResponse.accepted();
    }
    
    /**
     * 数据访问
     */
    @PostMapping("/events/data-access")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ApiResponse<Void> dataAccess(@RequestBody DataAccessRequest request) {
        engine.onDataAccess(request.getCategory(), request.getIdentifier(), request.getParams());
        return ApiResponse.accepted();
    }
    
    /**
     * 预测预览（不入队）
     */
    @GetMapping("/predictions")
    public ApiResponse<List<PrefetchCandidate>> predictions(@RequestParam String route) {
        return ApiResponse.success(engine.previewPredictions(route));
    }
    
    @GetMapping("/stats")
    public ApiResponse<PrefetchStats> stats() {
        return ApiResponse.success(engine.getStats());
    }
    
    @GetMapping("/state")
    public ApiResponse<EngineState> state() {
        return ApiResponse.success(engine.getState());
    }
    
    /**
     * 清空行为数据与持久化快照
     */
    @DeleteMapping("/reset")
    public ApiResponse<Void> reset() {
        log.warn("Manual prefetch engine reset triggered!");
        engine.reset();
        return ApiResponse.success();
    }
}
