package com.producthub.prefetch.init;

import com.producthub.prefetch.event.ComponentInteractionEvent;
import com.producthub.prefetch.event.DataAccessEvent;
import com.producthub.prefetch.event.RouteChangeEvent;
import com.producthub.prefetch.service.DataPrefetchEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 进程内事件订阅，把宿主发布的事件转交预取引擎
 */
@Component
@RequiredArgsConstructor
public class PrefetchEventListener {
    
    private final DataPrefetchEngine engine;
    
    @EventListener
    public void onRouteChange(RouteChangeEvent event) {
        engine.onRouteChange(event.fromRoute(), event.toRoute(), event.timeSpentMs());
    }
    
    @EventListener
    public void onDataAccess(DataAccessEvent event) {
        engine.onDataAccess(event.category(), event.identifier(), event.params());
    }
    
    @EventListener
    public void onComponentInteraction(ComponentInteractionEvent event) {
        engine.onComponentInteraction(event.payload());
    }
}
