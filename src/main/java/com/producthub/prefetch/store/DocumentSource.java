package com.producthub.prefetch.store;

import java.util.List;
import java.util.Map;

/**
 * 文档数据源
 */
public interface DocumentSource {
    
    /**
     * 查询集合，params 中 limit 限制条数，其余为顶层字段的等值过滤
     */
    List<Map<String, Object>> getCollection(String collection, Map<String, Object> params);
    
    /**
     * @return 文档内容，不存在返回 null
     */
    Map<String, Object> getDocument(String collection, String documentId);
}
