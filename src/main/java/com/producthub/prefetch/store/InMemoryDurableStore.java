package com.producthub.prefetch.store;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内持久化存储（本地开发与测试）
 */
@Component
@ConditionalOnProperty(prefix = "prefetch.persistence", name = "store", havingValue = "memory")
public class InMemoryDurableStore implements DurableStore {
    
    private final Map<String, String> items = new ConcurrentHashMap<>();
    
    @Override
    public String getItem(String key) {
        return items.get(key);
    }
    
    @Override
    public void setItem(String key, String value) {
        items.put(key, value);
    }
    
    @Override
    public void removeItem(String key) {
        items.remove(key);
    }
}
