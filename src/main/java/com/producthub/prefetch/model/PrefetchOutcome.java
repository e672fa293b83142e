package com.producthub.prefetch.model;

/**
 * 单条数据需求的预取结果
 */
public enum PrefetchOutcome {
    /** 缓存已有，跳过 */
    CACHE_HIT,
    /** 拉取并写入缓存 */
    PREFETCHED,
    /** 数据源无数据或分类未知 */
    EMPTY,
    /** 拉取失败 */
    FAILED
}
