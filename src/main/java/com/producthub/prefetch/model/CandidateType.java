package com.producthub.prefetch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 预取候选来源
 */
public enum CandidateType {
    ROUTE("route"),
    RELATED_DATA("related_data");
    
    private final String code;
    
    CandidateType(String code) {
        this.code = code;
    }
    
    @JsonValue
    public String code() {
        return code;
    }
}
