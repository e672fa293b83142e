package com.producthub.prefetch.store;

/**
 * 持久化键值存储
 */
public interface DurableStore {
    
    /**
     * @return 存储的字符串，不存在返回 null
     */
    String getItem(String key);
    
    void setItem(String key, String value);
    
    void removeItem(String key);
}
