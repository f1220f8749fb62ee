package com.cardhub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 客户端错误（参数错误、规则校验失败等）
     * 404: 资源不存在
     * 409: 冲突（并发锁冲突、业务状态错误）
     * 500: 服务器错误
     */
    int code,

    /**
     * 响应消息
     */
    String message,

    /**
     * 业务错误码（成功时为 null），如 NOT_YOUR_TURN
     */
    String errorCode,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", null, data);
    }

    /**
     * 成功响应（带消息和数据）
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, message, null, data);
    }

    /**
     * 失败响应（带业务错误码与附加数据，例如“必须打出的牌”）
     */
    public static <T> ApiResponse<T> error(int code, String errorCode, String message, T data) {
        return new ApiResponse<>(code, message, errorCode, data);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null, null);
    }

    /**
     * 失败响应（404 Not Found）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, message, null, null);
    }

    /**
     * 失败响应（409 Conflict）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null, null);
    }

    /** 是否成功 */
    public boolean isSuccess() {
        return code == 200;
    }
}
