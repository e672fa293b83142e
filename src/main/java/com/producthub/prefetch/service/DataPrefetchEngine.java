package com.producthub.prefetch.service;

import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.model.CandidateType;
import com.producthub.prefetch.model.ComponentInteractionStat;
import com.producthub.prefetch.model.DataRequirement;
import com.producthub.prefetch.model.EngineState;
import com.producthub.prefetch.model.PrefetchCandidate;
import com.producthub.prefetch.model.PrefetchStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 数据预取引擎 - 对外入口
 * 
 * 生命周期：UNINITIALIZED -> (加载快照) -> COLD | WARM -> RUNNING
 * reset 清空内存与持久化数据，经 COLD 回到 RUNNING
 * 
 * 所有入站事件在此处理，任何异常都只记录日志，预取故障不影响宿主的数据读取
 */
@Slf4j
@Service
public class DataPrefetchEngine {
    
    /** 交互直接指定的预取目标不经过置信度评分 */
    static final double DIRECT_TARGET_CONFIDENCE = 1.0;
    
    private final PrefetchProperties properties;
    private final BehaviorTracker behaviorTracker;
    private final PredictionEngine predictionEngine;
    private final PrefetchScheduler prefetchScheduler;
    private final PatternPersistence patternPersistence;
    private final Clock clock;
    private final ScheduledExecutorService timer;
    
    private final Counter predictionCounter;
    
    private volatile EngineState state = EngineState.UNINITIALIZED;
    private ScheduledFuture<?> tickTask;
    
    // 仅有目标路由的导航事件需要的上下文
    private final Object navigationLock = new Object();
    private String currentRoute;
    private long routeEnteredAt;
    
    @Autowired
    public DataPrefetchEngine(PrefetchProperties properties,
                              BehaviorTracker behaviorTracker,
                              PredictionEngine predictionEngine,
                              PrefetchScheduler prefetchScheduler,
                              PatternPersistence patternPersistence,
                              Clock clock,
                              MeterRegistry meterRegistry) {
        this(properties, behaviorTracker, predictionEngine, prefetchScheduler, patternPersistence, clock,
            meterRegistry, Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "prefetch-timer");
                t.setDaemon(true);
                return t;
            }));
    }
    
    DataPrefetchEngine(PrefetchProperties properties,
                       BehaviorTracker behaviorTracker,
                       PredictionEngine predictionEngine,
                       PrefetchScheduler prefetchScheduler,
                       PatternPersistence patternPersistence,
                       Clock clock,
                       MeterRegistry meterRegistry,
                       ScheduledExecutorService timer) {
        this.properties = properties;
        this.behaviorTracker = behaviorTracker;
        this.predictionEngine = predictionEngine;
        this.prefetchScheduler = prefetchScheduler;
        this.patternPersistence = patternPersistence;
        this.clock = clock;
        this.timer = timer;
        this.predictionCounter = Counter.builder("prefetch.predictions.scheduled")
            .description("Predictions handed to the prefetch scheduler")
            .register(meterRegistry);
    }
    
    // ==================== 生命周期 ====================
    
    /**
     * 加载历史快照并启动周期处理，重复调用无副作用
     */
    public synchronized void start() {
        if (state == EngineState.UNINITIALIZED) {
            boolean warm = patternPersistence.load();
            transition(warm ? EngineState.WARM : EngineState.COLD);
        }
        if (state == EngineState.RUNNING) {
            return;
        }
        if (!properties.isEnabled()) {
            log.info("Data prefetching disabled, engine stays {}", state);
            return;
        }
        long interval = properties.getTickIntervalMs();
        tickTask = timer.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        transition(EngineState.RUNNING);
        log.info("DataPrefetchEngine started: maxConcurrent={}, tick={}ms, minConfidence={}",
            properties.getMaxConcurrentPrefetch(), interval, properties.getMinConfidenceScore());
    }
    
    @PreDestroy
    public synchronized void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }
        timer.shutdownNow();
    }
    
    private void tick() {
        try {
            prefetchScheduler.processTick();
        } catch (RuntimeException e) {
            // 异常会终止周期任务，必须在此截住
            log.warn("Prefetch tick failed", e);
        }
    }
    
    private void transition(EngineState next) {
        log.info("Prefetch engine state: {} -> {}", state, next);
        state = next;
    }
    
    public EngineState getState() {
        return state;
    }
    
    // ==================== 入站事件 ====================
    
    /**
     * 路由跳转：记录、持久化并按新路由预测
     */
    public void onRouteChange(String fromRoute, String toRoute, long timeSpentMs) {
        if (!properties.isEnabled()) {
            return;
        }
        if (fromRoute == null || toRoute == null) {
            log.warn("Ignoring route change with missing route: {} -> {}", fromRoute, toRoute);
            return;
        }
        synchronized (navigationLock) {
            currentRoute = toRoute;
            routeEnteredAt = clock.millis();
        }
        try {
            behaviorTracker.recordRouteTransition(fromRoute, toRoute, timeSpentMs);
            patternPersistence.save();
            predictAndPrefetch(toRoute);
        } catch (RuntimeException e) {
            log.warn("Failed to handle route change {} -> {}", fromRoute, toRoute, e);
        }
    }
    
    /**
     * 只知道目标路由的导航：来源路由与停留时长取自上一次导航
     * 首次导航与同路由导航不产生跳转
     */
    public void onNavigation(String route) {
        if (!properties.isEnabled() || route == null) {
            return;
        }
        String fromRoute;
        long timeSpent;
        synchronized (navigationLock) {
            long now = clock.millis();
            if (currentRoute == null) {
                currentRoute = route;
                routeEnteredAt = now;
                return;
            }
            if (currentRoute.equals(route)) {
                return;
            }
            fromRoute = currentRoute;
            timeSpent = now - routeEnteredAt;
        }
        onRouteChange(fromRoute, route, timeSpent);
    }
    
    /**
     * 数据访问
     */
    public void onDataAccess(String category, String identifier, Map<String, Object> params) {
        if (!properties.isEnabled()) {
            return;
        }
        if (category == null || identifier == null) {
            log.warn("Ignoring data access with missing key: {}:{}", category, identifier);
            return;
        }
        try {
            behaviorTracker.recordDataAccess(category, identifier, params);
            patternPersistence.save();
        } catch (RuntimeException e) {
            log.warn("Failed to record data access {}:{}", category, identifier, e);
        }
    }
    
    /**
     * 界面交互：合法载荷中指定的预取目标延迟 prefetchDelay 后直接入队
     */
    public void onComponentInteraction(String payload) {
        if (!properties.isEnabled()) {
            return;
        }
        try {
            behaviorTracker.recordComponentInteraction(payload).ifPresent(stat -> {
                patternPersistence.save();
                scheduleDirectTargets(stat);
            });
        } catch (RuntimeException e) {
            log.warn("Failed to record component interaction", e);
        }
    }
    
    private void scheduleDirectTargets(ComponentInteractionStat stat) {
        List<DataRequirement> targets = stat.getPrefetchTargets();
        if (targets.isEmpty()) {
            return;
        }
        try {
            timer.schedule(() -> targets.forEach(target -> prefetchScheduler.schedule(new PrefetchCandidate(
                CandidateType.RELATED_DATA, target.targetKey(), DIRECT_TARGET_CONFIDENCE, List.of(target)))),
                properties.getPrefetchDelayMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Engine timer unavailable, dropping {} interaction targets", targets.size());
        }
    }
    
    // ==================== 预测 ====================
    
    /**
     * 按当前路由生成预测并把达标候选交给调度器
     * @return 新入队的候选数
     */
    public int predictAndPrefetch(String route) {
        int scheduled = 0;
        for (PrefetchCandidate candidate : predictionEngine.generatePredictions(route)) {
            if (candidate.confidence() >= properties.getMinConfidenceScore()
                    && prefetchScheduler.schedule(candidate)) {
                scheduled++;
            }
        }
        if (scheduled > 0) {
            predictionCounter.increment(scheduled);
            log.debug("Scheduled {} prefetch candidates for route {}", scheduled, route);
        }
        return scheduled;
    }
    
    public List<PrefetchCandidate> previewPredictions(String route) {
        return predictionEngine.generatePredictions(route);
    }
    
    // ==================== 观测 / 重置 ====================
    
    public PrefetchStats getStats() {
        return new PrefetchStats(
            behaviorTracker.routeTransitionCount(),
            behaviorTracker.behaviorPatternCount(),
            behaviorTracker.componentStatCount(),
            prefetchScheduler.pendingSize(),
            prefetchScheduler.inProgressSize(),
            behaviorTracker.totalObservedAccesses());
    }
    
    /**
     * 清空全部行为数据、预取队列与持久化快照
     */
    public synchronized void reset() {
        patternPersistence.clearAll();
        prefetchScheduler.clear();
        synchronized (navigationLock) {
            currentRoute = null;
            routeEnteredAt = 0;
        }
        transition(EngineState.COLD);
        if (tickTask != null) {
            transition(EngineState.RUNNING);
        }
        log.info("Prefetching engine reset");
    }
}
