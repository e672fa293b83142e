package com.producthub.prefetch.model;

import java.util.List;

/**
 * 预取候选
 */
public record PrefetchCandidate(
    CandidateType type,
    String target,
    double confidence,
    List<DataRequirement> dataRequirements
) {
    
    public PrefetchCandidate {
        dataRequirements = dataRequirements == null ? List.of() : List.copyOf(dataRequirements);
    }
    
    /**
     * 队列去重 Key：{@code type:target}
     */
    public String queueKey() {
        return type.code() + ":" + target;
    }
}
