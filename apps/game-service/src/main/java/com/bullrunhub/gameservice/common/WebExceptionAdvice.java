package com.bullrunhub.gameservice.common;

import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomError;
import com.bullrunhub.gameservice.games.bullrun.domain.error.RoomException;
import com.bullrunhub.web.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 房间业务异常：房间不存在 → 404，其余校验失败 → 409
     */
    @ExceptionHandler(RoomException.class)
    public ResponseEntity<ApiResponse<Object>> room(RoomException e) {
        if (e.getError() == RoomError.ROOM_NOT_FOUND) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 处理非法状态异常（IllegalStateException），例如对局未开始时结束对局。
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
