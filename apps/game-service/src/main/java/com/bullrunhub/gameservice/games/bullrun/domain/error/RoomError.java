package com.bullrunhub.gameservice.games.bullrun.domain.error;

/**
 * 房间相关的校验错误码。
 */
public enum RoomError {
    ROOM_NOT_FOUND,
    GAME_ALREADY_STARTED,
    PLAYER_ALREADY_PRESENT,
    INSUFFICIENT_PLAYERS,
    NOT_HOST,
    NOT_IN_ROOM,
    INVALID_CONFIG,
    MARKET_DATA_UNAVAILABLE,
    PLAYER_IN_OTHER_ROOM
}
