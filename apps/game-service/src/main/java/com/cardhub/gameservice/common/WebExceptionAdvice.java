package com.cardhub.gameservice.common;

import com.cardhub.web.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 * 规则校验失败不走异常（由控制器按 MoveResult 映射），这里只处理真正的异常。
 */
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 房间不存在。
     * @return HTTP 404（Not Found）
     */
    @ExceptionHandler(RoomNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> notFound(RoomNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * 典型场景：牌面编码非法、座位号越界。
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 处理非法状态异常（IllegalStateException）。
     * 该异常通常用于业务状态不符合预期的场景，例如重复开局。
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
