package com.producthub.prefetch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 数据访问模式，Key 为 {@code category:identifier}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccessPattern {
    
    private int accessCount;
    private long lastAccess;
    
    /** 统计窗口内的访问时间戳 */
    private List<Long> accessTimes = new ArrayList<>();
    
    /** 其他模式 Key -> 共现次数 */
    private Map<String, Integer> relatedAccesses = new LinkedHashMap<>();
    
    /** 序列化参数 -> 次数 */
    private Map<String, Integer> paramVariants = new LinkedHashMap<>();
    
    /**
     * 记录一次访问，并剔除超出窗口的时间戳
     */
    public void recordAccess(long now, long trackingWindowMs, String paramKey) {
        accessCount++;
        lastAccess = now;
        accessTimes.add(now);
        accessTimes.removeIf(time -> now - time >= trackingWindowMs);
        paramVariants.merge(paramKey, 1, Integer::sum);
    }
    
    public void recordRelated(String otherKey) {
        relatedAccesses.merge(otherKey, 1, Integer::sum);
    }
    
    public int relatedCount(String otherKey) {
        return relatedAccesses.getOrDefault(otherKey, 0);
    }
    
    public AccessPattern copy() {
        return new AccessPattern(accessCount, lastAccess,
            new ArrayList<>(accessTimes),
            new LinkedHashMap<>(relatedAccesses),
            new LinkedHashMap<>(paramVariants));
    }
}
