package com.bullrunhub.gameservice.games.bullrun.domain.enums;

/**
 * 服务端推送的事件类型（BroadcastEvent.type）。
 */
public enum EventType {
    ROOM_CREATED,
    PLAYER_JOINED,
    PLAYER_LEFT,
    GAME_STARTED,
    GAME_ENDED,
    GAME_PAUSED,
    GAME_RESUMED,
    TIME_PROGRESSION,
    LEADERBOARD_UPDATE,
    PRICE_TICK,
    GAME_STATE,
    QUIZ_TRIGGERED,
    QUIZ_COMPLETED,
    ADMIN_SETTINGS_UPDATED,
    ERROR,
    // 以下只走私有队列
    KEY_EXCHANGE,
    LIFE_EVENT
}
