package com.producthub.prefetch.constant;

/**
 * 预取引擎常量
 */
public final class PrefetchConstants {
    
    private PrefetchConstants() {}
    
    // ==================== 持久化 ====================
    
    /** 行为模式快照的持久化 Key */
    public static final String SNAPSHOT_KEY = "phapp_behavior_patterns";
    
    // ==================== 行为统计 ====================
    
    /** 关联访问窗口（毫秒），5 分钟内的访问视为相关 */
    public static final long RELATED_WINDOW_MS = 5 * 60 * 1000L;
    
    /** 路由跳转置信度饱和次数 */
    public static final int CONFIDENCE_SATURATION_COUNT = 10;
    
    /** 关联预测要求的最小访问次数（严格大于） */
    public static final int MIN_PATTERN_ACCESS_COUNT = 2;
    
    /** 关联预测要求的最小共现次数（严格大于） */
    public static final int MIN_RELATED_COUNT = 1;
    
    // ==================== Key 格式 ====================
    
    /** 路由跳转 Key 分隔符 */
    public static final String ROUTE_SEPARATOR = " -> ";
    
    /** 数据访问 Key 分隔符 category:identifier */
    public static final String DATA_KEY_SEPARATOR = ":";
    
    /** 交互统计 Key 前缀 */
    public static final String INTERACTION_PREFIX = "interaction:";
    
    /** 通配标识，表示整个集合 */
    public static final String ALL_IDENTIFIER = "all";
}
