package com.dinoroyale.matchservice.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param code    状态码：200 成功，400 参数错误，409 业务状态冲突
 * @param message 响应消息
 * @param data    响应数据
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }
}
