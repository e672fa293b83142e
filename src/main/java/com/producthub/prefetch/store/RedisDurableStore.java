package com.producthub.prefetch.store;

import com.producthub.prefetch.exception.PersistenceException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis 持久化存储
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "prefetch.persistence", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisDurableStore implements DurableStore {
    
    private final StringRedisTemplate redisTemplate;
    
    @Override
    public String getItem(String key) {
        try {
            return redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new PersistenceException("Redis GET failed: " + key, e);
        }
    }
    
    @Override
    public void setItem(String key, String value) {
        try {
            redisTemplate.opsForValue().set(key, value);
        } catch (DataAccessException e) {
            throw new PersistenceException("Redis SET failed: " + key, e);
        }
    }
    
    @Override
    public void removeItem(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            throw new PersistenceException("Redis DEL failed: " + key, e);
        }
    }
}
