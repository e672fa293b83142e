package com.producthub.prefetch.exception;

/**
 * 数据源拉取失败
 */
public class FetchFailureException extends PrefetchException {
    
    public FetchFailureException(String category, String identifier, Throwable cause) {
        super("Failed to fetch " + category + ":" + identifier, cause);
    }
}
