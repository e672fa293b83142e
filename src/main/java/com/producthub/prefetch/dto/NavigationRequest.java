package com.producthub.prefetch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 仅携带目标路由的导航事件，来源路由与停留时长由引擎推算
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NavigationRequest {
    private String route;
}
