package com.producthub.prefetch.service;

import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.constant.PrefetchConstants;
import com.producthub.prefetch.model.AccessPattern;
import com.producthub.prefetch.model.CandidateType;
import com.producthub.prefetch.model.DataRequirement;
import com.producthub.prefetch.model.PatternSnapshot;
import com.producthub.prefetch.model.PrefetchCandidate;
import com.producthub.prefetch.model.RouteTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 预测引擎
 * 
 * 两个独立来源：
 * 1. 路由预测 - 当前路由出发的跳转中置信度达标的目标路由
 * 2. 关联预测 - 活跃访问模式中共现次数达标的关联数据
 * 
 * 结果按置信度降序，同分保持生成顺序
 */
@Slf4j
@Service
public class PredictionEngine {
    
    private final BehaviorTracker behaviorTracker;
    private final RouteDataRequirements routeDataRequirements;
    private final PrefetchProperties properties;
    private final Clock clock;
    
    public PredictionEngine(BehaviorTracker behaviorTracker,
                            RouteDataRequirements routeDataRequirements,
                            PrefetchProperties properties,
                            Clock clock) {
        this.behaviorTracker = behaviorTracker;
        this.routeDataRequirements = routeDataRequirements;
        this.properties = properties;
        this.clock = clock;
    }
    
    /**
     * 生成预测列表，冷启动时为空
     */
    public List<PrefetchCandidate> generatePredictions(String currentRoute) {
        PatternSnapshot snapshot = behaviorTracker.snapshot();
        List<PrefetchCandidate> predictions = new ArrayList<>();
        
        if (currentRoute != null) {
            predictFromRoutes(currentRoute, snapshot, predictions);
        }
        predictFromCorrelations(snapshot, clock.millis(), predictions);
        
        // List.sort 为稳定排序
        predictions.sort(Comparator.comparingDouble(PrefetchCandidate::confidence).reversed());
        log.debug("Generated {} predictions for route {}", predictions.size(), currentRoute);
        return predictions;
    }
    
    private void predictFromRoutes(String currentRoute, PatternSnapshot snapshot, List<PrefetchCandidate> out) {
        String prefix = currentRoute + PrefetchConstants.ROUTE_SEPARATOR;
        double minConfidence = properties.getMinConfidenceScore();
        
        for (PatternSnapshot.Entry<RouteTransition> entry : snapshot.getRouteTransitions()) {
            RouteTransition transition = entry.value();
            if (entry.key().startsWith(prefix) && transition.getConfidence() >= minConfidence) {
                String targetRoute = entry.key().substring(prefix.length());
                out.add(new PrefetchCandidate(
                    CandidateType.ROUTE,
                    targetRoute,
                    transition.getConfidence(),
                    routeDataRequirements.requirementsFor(targetRoute)));
            }
        }
    }
    
    private void predictFromCorrelations(PatternSnapshot snapshot, long now, List<PrefetchCandidate> out) {
        double minConfidence = properties.getMinConfidenceScore();
        long window = properties.getBehaviorTrackingWindowMs();
        
        for (PatternSnapshot.Entry<AccessPattern> entry : snapshot.getUserBehaviorPatterns()) {
            AccessPattern pattern = entry.value();
            if (pattern.getAccessCount() <= PrefetchConstants.MIN_PATTERN_ACCESS_COUNT
                    || now - pattern.getLastAccess() >= window) {
                continue;
            }
            for (Map.Entry<String, Integer> related : pattern.getRelatedAccesses().entrySet()) {
                int relatedCount = related.getValue();
                if (relatedCount <= PrefetchConstants.MIN_RELATED_COUNT) {
                    continue;
                }
                double confidence = Math.min((double) relatedCount / pattern.getAccessCount(), 1.0);
                if (confidence >= minConfidence) {
                    out.add(new PrefetchCandidate(
                        CandidateType.RELATED_DATA,
                        related.getKey(),
                        confidence,
                        List.of(DataRequirement.parseKey(related.getKey()))));
                }
            }
        }
    }
}
