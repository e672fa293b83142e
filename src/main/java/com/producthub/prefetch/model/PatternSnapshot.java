package com.producthub.prefetch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 行为模式快照，三张表以 (key, value) 列表形式保存，便于按顺序恢复
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PatternSnapshot {
    
    private List<Entry<RouteTransition>> routeTransitions = new ArrayList<>();
    private List<Entry<AccessPattern>> userBehaviorPatterns = new ArrayList<>();
    private List<Entry<ComponentInteractionStat>> componentUsageStats = new ArrayList<>();
    
    /** 保存时间 */
    private long timestamp;
    
    public record Entry<T>(String key, T value) {}
}
