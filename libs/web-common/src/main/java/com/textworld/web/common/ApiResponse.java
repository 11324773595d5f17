package com.textworld.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param code    状态码：200 成功；400 输入不合法；404 房间不存在；409 状态冲突；500 服务器错误
 * @param message 给玩家看的提示（失败时为拒绝原因）
 * @param data    响应数据
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;
    public static final int SERVER_ERROR = 500;

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    /**
     * 成功响应（带消息和数据）
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(OK, message, data);
    }

    /**
     * 失败响应（400 玩家输入不合法）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(BAD_REQUEST, message, null);
    }

    /**
     * 失败响应（404 房间或玩家不存在）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(NOT_FOUND, message, null);
    }

    /**
     * 失败响应（409 阶段不对、非房主、已行动、房间已满等）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(CONFLICT, message, null);
    }

    /**
     * 失败响应（500）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(SERVER_ERROR, message, null);
    }

    public boolean isSuccess() {
        return code == OK;
    }
}
