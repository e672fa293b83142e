package com.producthub.prefetch.store;

import java.util.Map;

/**
 * 数据拉取器，超时与重试策略由实现自行负责
 */
public interface DataFetcher {
    
    /**
     * @return 数据，无数据或分类未知时返回 null
     * @throws com.producthub.prefetch.exception.FetchFailureException 数据源异常
     */
    Object fetch(String category, String identifier, Map<String, Object> params);
}
