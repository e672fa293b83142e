package com.producthub.prefetch.exception;

/**
 * 预取子系统异常基类，均在引擎边界处被捕获并记录，不向宿主应用传播
 */
public class PrefetchException extends RuntimeException {
    
    public PrefetchException(String message) {
        super(message);
    }
    
    public PrefetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
