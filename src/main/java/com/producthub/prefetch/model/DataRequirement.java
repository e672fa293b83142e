package com.producthub.prefetch.model;

import com.producthub.prefetch.constant.PrefetchConstants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 一条数据需求 {category, identifier, params}
 */
public record DataRequirement(String category, String identifier, Map<String, Object> params) {
    
    public DataRequirement {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
    
    public static DataRequirement of(String category, String identifier) {
        return new DataRequirement(category, identifier, Map.of());
    }
    
    /**
     * 解析 {@code category:identifier}，标识中允许继续出现冒号
     */
    public static DataRequirement parseKey(String dataKey) {
        int idx = dataKey.indexOf(PrefetchConstants.DATA_KEY_SEPARATOR);
        if (idx < 0) {
            return of(dataKey, PrefetchConstants.ALL_IDENTIFIER);
        }
        return of(dataKey.substring(0, idx), dataKey.substring(idx + 1));
    }
    
    public String dataKey() {
        return category + PrefetchConstants.DATA_KEY_SEPARATOR + identifier;
    }
    
    /**
     * 带参数的目标标识，参数按名称排序；无参数时等同 {@link #dataKey()}
     */
    public String targetKey() {
        if (params.isEmpty()) {
            return dataKey();
        }
        return dataKey() + PrefetchConstants.DATA_KEY_SEPARATOR + new TreeMap<>(params);
    }
}
