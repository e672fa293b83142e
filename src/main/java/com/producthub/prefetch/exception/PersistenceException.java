package com.producthub.prefetch.exception;

/**
 * 持久化存储不可用或写入失败
 */
public class PersistenceException extends PrefetchException {
    
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
