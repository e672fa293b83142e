package com.producthub.prefetch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应包装
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {
    
    private int code;
    private String message;
    private T data;
    private long timestamp;
    
    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
            .code(0)
            .message("success")
            .data(data)
            .timestamp(System.currentTimeMillis())
            .build();
    }
    
    public static <T> ApiResponse<T> success() {
        return success(null);
    }
    
    /**
     * 事件已接收（是否被记录由引擎决定）
     */
    public static <T> ApiResponse<T> accepted() {
        return ApiResponse.<T>builder()
            .code(0)
            .message("accepted")
            .timestamp(System.currentTimeMillis())
            .build();
    }
    
    public static <T> ApiResponse<T> error(int code, String message) {
        return ApiResponse.<T>builder()
            .code(code)
            .message(message)
            .timestamp(System.currentTimeMillis())
            .build();
    }
    
    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }
    
    public static <T> ApiResponse<T> serverError(String message) {
        return error(500, message);
    }
}
