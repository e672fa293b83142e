package com.producthub.prefetch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 界面交互统计，Key 为 {@code interaction:type:identifier}
 * prefetchTargets 在首次观察时确定，之后不再变化
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComponentInteractionStat {
    
    private int count;
    private long lastAccess;
    private List<DataRequirement> prefetchTargets = new ArrayList<>();
    
    public void record(long now) {
        count++;
        lastAccess = now;
    }
    
    public ComponentInteractionStat copy() {
        return new ComponentInteractionStat(count, lastAccess, new ArrayList<>(prefetchTargets));
    }
}
