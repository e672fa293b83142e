package com.producthub.prefetch.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 数据访问事件 {category, identifier, params}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DataAccessRequest {
    private String category;
    private String identifier;
    private Map<String, Object> params = new LinkedHashMap<>();
}
