package com.producthub.prefetch.init;

import com.producthub.prefetch.service.DataPrefetchEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 应用就绪后加载历史行为并启动预取引擎
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PrefetchLifecycleListener {
    
    private final DataPrefetchEngine engine;
    
    @EventListener(ApplicationReadyEvent.class)
    public void startEngine() {
        log.info(">>> Starting data prefetch engine...");
        long startTime = System.currentTimeMillis();
        try {
            engine.start();
            log.info(">>> Data prefetch engine {} in {} ms", engine.getState(), System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            // 启动失败不影响应用
            log.error(">>> Data prefetch engine failed to start", e);
        }
    }
}
