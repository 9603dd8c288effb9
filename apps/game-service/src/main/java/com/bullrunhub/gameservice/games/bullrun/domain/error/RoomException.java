package com.bullrunhub.gameservice.games.bullrun.domain.error;

import lombok.Getter;

/**
 * 房间校验失败。message 直接展示给发起请求的客户端，不能包含密钥等内部信息。
 */
@Getter
public class RoomException extends RuntimeException {

    private final RoomError error;

    public RoomException(RoomError error, String message) {
        super(message);
        this.error = error;
    }
}
