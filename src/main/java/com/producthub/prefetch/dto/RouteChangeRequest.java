package com.producthub.prefetch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 路由跳转事件 {fromRoute, toRoute, timeSpentMs}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteChangeRequest {
    private String fromRoute;
    private String toRoute;
    private long timeSpentMs;
}
