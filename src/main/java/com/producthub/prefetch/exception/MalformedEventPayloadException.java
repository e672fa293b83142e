package com.producthub.prefetch.exception;

/**
 * 交互事件载荷无法解析
 */
public class MalformedEventPayloadException extends PrefetchException {
    
    public MalformedEventPayloadException(String message) {
        super(message);
    }
    
    public MalformedEventPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
