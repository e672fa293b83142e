package com.producthub.prefetch.store;

import com.producthub.prefetch.constant.PrefetchConstants;
import com.producthub.prefetch.exception.FetchFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 按数据分类分发到文档数据源
 * 
 * products -> products 集合
 * coverages -> identifier 为 all 时取集合，否则取单个文档
 * forms / rules / tasks -> 同名集合
 * pricing / steps -> steps 集合
 */
@Slf4j
@Component
public class CategoryDataFetcher implements DataFetcher {
    
    @FunctionalInterface
    interface FetchOperation {
        Object fetch(String identifier, Map<String, Object> params);
    }
    
    private final Map<String, FetchOperation> operations;
    
    public CategoryDataFetcher(DocumentSource documentSource) {
        Map<String, FetchOperation> table = new LinkedHashMap<>();
        table.put("products", (id, params) -> documentSource.getCollection("products", params));
        table.put("coverages", (id, params) -> PrefetchConstants.ALL_IDENTIFIER.equals(id)
            ? documentSource.getCollection("coverages", params)
            : documentSource.getDocument("coverages", id));
        table.put("forms", (id, params) -> documentSource.getCollection("forms", params));
        table.put("rules", (id, params) -> documentSource.getCollection("rules", params));
        table.put("tasks", (id, params) -> documentSource.getCollection("tasks", params));
        table.put("pricing", (id, params) -> documentSource.getCollection("steps", params));
        table.put("steps", (id, params) -> documentSource.getCollection("steps", params));
        this.operations = Collections.unmodifiableMap(table);
    }
    
    @Override
    public Object fetch(String category, String identifier, Map<String, Object> params) {
        FetchOperation operation = operations.get(category);
        if (operation == null) {
            log.warn("Unknown data category: {}", category);
            return null;
        }
        try {
            return operation.fetch(identifier, params == null ? Map.of() : params);
        } catch (RuntimeException e) {
            throw new FetchFailureException(category, identifier, e);
        }
    }
    
    public Set<String> supportedCategories() {
        return operations.keySet();
    }
}
