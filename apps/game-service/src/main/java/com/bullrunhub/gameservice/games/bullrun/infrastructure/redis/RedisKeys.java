package com.bullrunhub.gameservice.games.bullrun.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "bullrun:";

    private RedisKeys() {}

    // ---- 房间内每名玩家最新的终局记录（Hash: playerId -> SessionRecord） ----
    public static String latestRecords(String roomCode) {
        return PFX + "room:" + roomCode + ":records";
    }

    // ---- 单次终局写入的完整记录 ----
    public static String sessionLog(String logId) {
        return PFX + "log:" + logId;
    }
}
