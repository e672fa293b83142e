package com.producthub.prefetch.service;

import com.producthub.prefetch.config.PrefetchProperties;
import com.producthub.prefetch.model.PrefetchCandidate;
import com.producthub.prefetch.model.PrefetchQueueItem;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 预取调度器
 * 
 * 待处理队列与进行中集合共用 {@code type:target} Key 空间，一个 Key 同一时刻只在其一。
 * 每个 tick 在进行中数量未达上限时，按当前置信度重新排序待处理队列并取出剩余容量的条目，
 * 异步执行，完成（成功或失败）后移出进行中集合，不重试。
 */
@Slf4j
@Service
public class PrefetchScheduler {
    
    private final PrefetchProperties properties;
    private final CacheBridge cacheBridge;
    private final Clock clock;
    private final Executor workerExecutor;
    
    private final Object monitor = new Object();
    private final Map<String, PrefetchQueueItem> pending = new LinkedHashMap<>();
    private final Map<String, PrefetchQueueItem> inProgress = new HashMap<>();
    
    private final Timer executionTimer;
    
    @Autowired
    public PrefetchScheduler(PrefetchProperties properties,
                             CacheBridge cacheBridge,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this(properties, cacheBridge, clock, meterRegistry, newWorkerPool(properties.effectiveWorkerPoolSize()));
    }
    
    PrefetchScheduler(PrefetchProperties properties,
                      CacheBridge cacheBridge,
                      Clock clock,
                      MeterRegistry meterRegistry,
                      Executor workerExecutor) {
        this.properties = properties;
        this.cacheBridge = cacheBridge;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
        
        this.executionTimer = Timer.builder("prefetch.execution.latency")
            .description("Prefetch candidate execution latency")
            .register(meterRegistry);
        Gauge.builder("prefetch.queue.size", this, PrefetchScheduler::pendingSize)
            .register(meterRegistry);
        Gauge.builder("prefetch.in_progress", this, PrefetchScheduler::inProgressSize)
            .register(meterRegistry);
    }
    
    private static ExecutorService newWorkerPool(int size) {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "prefetch-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
    
    @PreDestroy
    public void shutdown() {
        if (workerExecutor instanceof ExecutorService executorService) {
            executorService.shutdownNow();
        }
    }
    
    /**
     * 入队，Key 已在队列或执行中时忽略
     * @return 是否新入队
     */
    public boolean schedule(PrefetchCandidate candidate) {
        String key = candidate.queueKey();
        synchronized (monitor) {
            if (pending.containsKey(key) || inProgress.containsKey(key)) {
                return false;
            }
            pending.put(key, new PrefetchQueueItem(key, candidate, clock.millis()));
        }
        log.debug("Prefetch scheduled: key={}, confidence={}", key, candidate.confidence());
        return true;
    }
    
    /**
     * 处理一次队列
     * @return 本次派发的条目数
     */
    public int processTick() {
        List<PrefetchQueueItem> batch;
        synchronized (monitor) {
            int capacity = properties.getMaxConcurrentPrefetch() - inProgress.size();
            if (capacity <= 0 || pending.isEmpty()) {
                return 0;
            }
            batch = pending.values().stream()
                .sorted(Comparator.comparingDouble((PrefetchQueueItem item) -> item.candidate().confidence()).reversed())
                .limit(capacity)
                .toList();
            for (PrefetchQueueItem item : batch) {
                pending.remove(item.key());
                inProgress.put(item.key(), item);
            }
        }
        batch.forEach(this::dispatch);
        return batch.size();
    }
    
    private void dispatch(PrefetchQueueItem item) {
        try {
            CompletableFuture.runAsync(() -> execute(item), workerExecutor)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.warn("Prefetch failed: key={}", item.key(), error);
                    }
                    complete(item);
                });
        } catch (RejectedExecutionException e) {
            log.warn("Prefetch rejected by worker pool: key={}", item.key());
            complete(item);
        }
    }
    
    private void execute(PrefetchQueueItem item) {
        executionTimer.record(() -> {
            log.debug("Executing prefetch: key={}, requirements={}",
                item.key(), item.candidate().dataRequirements().size());
            cacheBridge.fetchAndCacheAll(item.candidate().dataRequirements());
        });
    }
    
    private void complete(PrefetchQueueItem item) {
        synchronized (monitor) {
            // reset 后同 Key 可能已被重新派发，只移除自己
            if (inProgress.get(item.key()) == item) {
                inProgress.remove(item.key());
            }
        }
    }
    
    public void clear() {
        synchronized (monitor) {
            pending.clear();
            inProgress.clear();
        }
    }
    
    public int pendingSize() {
        synchronized (monitor) {
            return pending.size();
        }
    }
    
    public int inProgressSize() {
        synchronized (monitor) {
            return inProgress.size();
        }
    }
    
    public boolean isPending(String key) {
        synchronized (monitor) {
            return pending.containsKey(key);
        }
    }
    
    public boolean isInProgress(String key) {
        synchronized (monitor) {
            return inProgress.containsKey(key);
        }
    }
    
    public List<PrefetchQueueItem> pendingItems() {
        synchronized (monitor) {
            return new ArrayList<>(pending.values());
        }
    }
}
