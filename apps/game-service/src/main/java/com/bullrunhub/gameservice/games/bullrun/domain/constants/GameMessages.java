package com.bullrunhub.gameservice.games.bullrun.domain.constants;

/**
 * 用户可见的提示消息，统一管理，避免硬编码。
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 房间 ==========

    public static final String ROOM_NOT_FOUND = "Room not found";

    public static final String GAME_IN_PROGRESS = "Game already in progress";

    public static final String GAME_ALREADY_STARTED = "Game already started";

    public static final String PLAYER_ALREADY_IN_ROOM = "Player already in room";

    public static final String PLAYER_IN_OTHER_ROOM = "Already in another room. Leave it first.";

    public static final String NEED_TWO_PLAYERS = "Need at least 2 players to start";

    public static final String NOT_IN_ROOM = "Not in a room";

    public static final String ONLY_HOST_CAN_START = "Only host can start the game";

    public static final String ONLY_HOST = "Only host can do that";

    public static final String HOST_LEFT = "Host left the game. Room closed.";

    public static final String SETTINGS_LOCKED = "Settings cannot be changed after the game has started";

    public static final String PLAYER_NAME_REQUIRED = "Player name is required";

    // ========== 开局 ==========

    public static final String DATABASE_UNAVAILABLE =
            "Database connection error. Please check the database or contact your administrator for assistance.";

    public static final String DATABASE_ERROR =
            "Database error occurred. Please contact your administrator for more information.";

    public static final String INVALID_GAME_CONFIG =
            "Invalid game configuration - missing asset selection or start year";

    public static final String GAME_NOT_STARTED = "Game has not started";

    public static final String KEYS_NOT_READY = "Encryption keys are not initialized for this room";

    /** 通用兜底 */
    public static final String REQUEST_FAILED = "Request failed";
}
