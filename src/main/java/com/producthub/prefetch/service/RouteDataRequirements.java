package com.producthub.prefetch.service;

import com.producthub.prefetch.model.DataRequirement;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 路由 -> 页面所需数据
 * 按声明顺序做前缀匹配，首个命中生效；动态路由（如 /coverage/123）按前缀归类
 */
@Component
public class RouteDataRequirements {
    
    private static final Map<String, List<DataRequirement>> ROUTE_DATA_MAP;
    
    static {
        Map<String, List<DataRequirement>> map = new LinkedHashMap<>();
        map.put("/products", List.of(DataRequirement.of("products", "all")));
        map.put("/coverage", List.of(
            DataRequirement.of("coverages", "all"),
            DataRequirement.of("forms", "all")));
        map.put("/pricing", List.of(
            DataRequirement.of("pricing", "all"),
            DataRequirement.of("steps", "all")));
        map.put("/forms", List.of(
            DataRequirement.of("forms", "all"),
            DataRequirement.of("formCoverages", "all")));
        map.put("/rules", List.of(DataRequirement.of("rules", "all")));
        map.put("/tasks", List.of(DataRequirement.of("tasks", "all")));
        map.put("/news", List.of(DataRequirement.of("news", "all")));
        ROUTE_DATA_MAP = Collections.unmodifiableMap(map);
    }
    
    /**
     * @return 路由所需数据，无匹配时为空列表（该路由不预取）
     */
    public List<DataRequirement> requirementsFor(String route) {
        if (route == null) {
            return List.of();
        }
        for (Map.Entry<String, List<DataRequirement>> entry : ROUTE_DATA_MAP.entrySet()) {
            if (route.startsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return List.of();
    }
}
