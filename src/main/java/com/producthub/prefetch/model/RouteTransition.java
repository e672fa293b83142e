package com.producthub.prefetch.model;

import com.producthub.prefetch.constant.PrefetchConstants;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 路由跳转统计，Key 为 {@code from -> to}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteTransition {
    
    private int count;
    private long totalTimeMs;
    private long lastAccess;
    private double confidence;
    
    /**
     * 记录一次跳转，置信度 = min(count / 10, 1)
     */
    public void record(long durationMs, long now) {
        count++;
        totalTimeMs += durationMs;
        lastAccess = now;
        confidence = confidenceFor(count);
    }
    
    public static double confidenceFor(int count) {
        return Math.min((double) count / PrefetchConstants.CONFIDENCE_SATURATION_COUNT, 1.0);
    }
    
    public RouteTransition copy() {
        return new RouteTransition(count, totalTimeMs, lastAccess, confidence);
    }
}
