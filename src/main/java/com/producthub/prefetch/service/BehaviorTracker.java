package com.producthub.prefetch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.constant.PrefetchConstants;
import com.producthub.prefetch.exception.MalformedEventPayloadException;
import com.producthub.prefetch.model.AccessPattern;
import com.producthub.prefetch.model.ComponentInteractionStat;
import com.producthub.prefetch.model.DataRequirement;
import com.producthub.prefetch.model.PatternSnapshot;
import com.producthub.prefetch.model.RouteTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 用户行为追踪器
 *
 * 维护三张统计表：
 * 1. 路由跳转 (from -> to)
 * 2. 数据访问模式 (category:identifier)，含窗口内访问时间、共现次数、参数分布
 * 3. 界面交互 (interaction:type:identifier)
 *
 * 事件来源互相独立，可能与预取调度并发，所有读写都经过读写锁
 */
@Slf4j
@Service
public class BehaviorTracker {

    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    private final PrefetchProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // 插入顺序即预测生成顺序
    private final Map<String, RouteTransition> routeTransitions = new LinkedHashMap<>();
    private final Map<String, AccessPattern> behaviorPatterns = new LinkedHashMap<>();
    private final Map<String, ComponentInteractionStat> componentStats = new LinkedHashMap<>();

    public BehaviorTracker(PrefetchProperties properties, Clock clock, ObjectMapper objectMapper) {
        this.properties = properties;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    // ==================== 路由跳转 ====================

    /**
     * 记录一次路由跳转
     * @return 更新后的统计副本
     */
    public RouteTransition recordRouteTransition(String fromRoute, String toRoute, long durationMs) {
        String key = routeKey(fromRoute, toRoute);
        long now = clock.millis();

        lock.writeLock().lock();
        try {
            RouteTransition transition = routeTransitions.computeIfAbsent(key, k -> new RouteTransition());
            transition.record(durationMs, now);
            log.debug("Route transition recorded: {} (count={}, confidence={})",
                key, transition.getCount(), transition.getConfidence());
            return transition.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public static String routeKey(String fromRoute, String toRoute) {
        return fromRoute + PrefetchConstants.ROUTE_SEPARATOR + toRoute;
    }

    // ==================== 数据访问 ====================

    /**
     * 记录一次数据访问
     *
     * 共现关系只记在已存在的其他模式上：最近 5 分钟内访问过的模式 X
     * 会得到 X.relatedAccesses[当前 Key] + 1，当前模式自身不记录
     */
    public AccessPattern recordDataAccess(String category, String identifier, Map<String, Object> params) {
        String currentKey = category + PrefetchConstants.DATA_KEY_SEPARATOR + identifier;
        String paramKey = serializeParams(params);
        long now = clock.millis();

        lock.writeLock().lock();
        try {
            AccessPattern pattern = behaviorPatterns.computeIfAbsent(currentKey, k -> new AccessPattern());
            pattern.recordAccess(now, properties.getBehaviorTrackingWindowMs(), paramKey);

            for (Map.Entry<String, AccessPattern> entry : behaviorPatterns.entrySet()) {
                AccessPattern other = entry.getValue();
                if (!entry.getKey().equals(currentKey)
                        && Math.abs(other.getLastAccess() - now) < PrefetchConstants.RELATED_WINDOW_MS) {
                    other.recordRelated(currentKey);
                }
            }
            return pattern.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private String serializeParams(Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(new TreeMap<>(params));
        } catch (JsonProcessingException e) {
            log.debug("Params not serializable, using toString: {}", e.getOriginalMessage());
            return new TreeMap<>(params).toString();
        }
    }

    // ==================== 界面交互 ====================

    /**
     * 记录界面交互，载荷格式 {type, identifier, prefetchTargets:[{category, identifier, params?}]}
     * 载荷非法时记录日志并丢弃，不抛异常
     *
     * @return 更新后的统计副本；载荷非法时为空
     */
    public Optional<ComponentInteractionStat> recordComponentInteraction(String payload) {
        ParsedInteraction interaction;
        try {
            interaction = parseInteraction(payload);
        } catch (MalformedEventPayloadException e) {
            log.warn("Dropping malformed interaction payload: {}", e.getMessage());
            return Optional.empty();
        }

        String key = PrefetchConstants.INTERACTION_PREFIX + interaction.type() + ":" + interaction.identifier();
        long now = clock.millis();

        lock.writeLock().lock();
        try {
            ComponentInteractionStat stat = componentStats.computeIfAbsent(key, k -> {
                ComponentInteractionStat created = new ComponentInteractionStat();
                created.setPrefetchTargets(new ArrayList<>(interaction.prefetchTargets()));
                return created;
            });
            stat.record(now);
            return Optional.of(stat.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private record ParsedInteraction(String type, String identifier, List<DataRequirement> prefetchTargets) {}

    private ParsedInteraction parseInteraction(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedEventPayloadException("empty payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedEventPayloadException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventPayloadException("payload is not a JSON object");
        }
        String type = requiredText(root, "type");
        String identifier = requiredText(root, "identifier");

        List<DataRequirement> targets = new ArrayList<>();
        JsonNode targetsNode = root.get("prefetchTargets");
        if (targetsNode != null && !targetsNode.isNull()) {
            if (!targetsNode.isArray()) {
                throw new MalformedEventPayloadException("prefetchTargets is not an array");
            }
            Iterator<JsonNode> it = targetsNode.elements();
            while (it.hasNext()) {
                targets.add(parseTarget(it.next()));
            }
        }
        return new ParsedInteraction(type, identifier, targets);
    }

    private DataRequirement parseTarget(JsonNode node) {
        if (!node.isObject()) {
            throw new MalformedEventPayloadException("prefetch target is not an object");
        }
        String category = requiredText(node, "category");
        String identifier = requiredText(node, "identifier");
        Map<String, Object> params = Map.of();
        JsonNode paramsNode = node.get("params");
        if (paramsNode != null && paramsNode.isObject()) {
            params = objectMapper.convertValue(paramsNode, PARAMS_TYPE);
        }
        return new DataRequirement(category, identifier, params);
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new MalformedEventPayloadException("missing field: " + field);
        }
        return value.asText();
    }

    // ==================== 快照 / 统计 ====================

    /**
     * 当前状态的深拷贝
     */
    public PatternSnapshot snapshot() {
        lock.readLock().lock();
        try {
            PatternSnapshot snapshot = new PatternSnapshot();
            routeTransitions.forEach((k, v) -> snapshot.getRouteTransitions().add(new PatternSnapshot.Entry<>(k, v.copy())));
            behaviorPatterns.forEach((k, v) -> snapshot.getUserBehaviorPatterns().add(new PatternSnapshot.Entry<>(k, v.copy())));
            componentStats.forEach((k, v) -> snapshot.getComponentUsageStats().add(new PatternSnapshot.Entry<>(k, v.copy())));
            snapshot.setTimestamp(clock.millis());
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 整体替换三张表
     */
    public void restore(PatternSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            clearUnderLock();
            snapshot.getRouteTransitions().forEach(e -> routeTransitions.put(e.key(), e.value().copy()));
            snapshot.getUserBehaviorPatterns().forEach(e -> behaviorPatterns.put(e.key(), e.value().copy()));
            snapshot.getComponentUsageStats().forEach(e -> componentStats.put(e.key(), e.value().copy()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            clearUnderLock();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void clearUnderLock() {
        routeTransitions.clear();
        behaviorPatterns.clear();
        componentStats.clear();
    }

    public Optional<RouteTransition> getRouteTransition(String fromRoute, String toRoute) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(routeTransitions.get(routeKey(fromRoute, toRoute))).map(RouteTransition::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AccessPattern> getAccessPattern(String category, String identifier) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(behaviorPatterns.get(category + PrefetchConstants.DATA_KEY_SEPARATOR + identifier))
                .map(AccessPattern::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int routeTransitionCount() {
        lock.readLock().lock();
        try {
            return routeTransitions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int behaviorPatternCount() {
        lock.readLock().lock();
        try {
            return behaviorPatterns.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int componentStatCount() {
        lock.readLock().lock();
        try {
            return componentStats.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 所有数据访问模式的累计访问次数
     */
    public long totalObservedAccesses() {
        lock.readLock().lock();
        try {
            return behaviorPatterns.values().stream().mapToLong(AccessPattern::getAccessCount).sum();
        } finally {
            lock.readLock().unlock();
        }
    }
}
