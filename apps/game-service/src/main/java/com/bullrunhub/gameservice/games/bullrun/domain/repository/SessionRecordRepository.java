package com.bullrunhub.gameservice.games.bullrun.domain.repository;

import java.util.List;

/**
 * SessionRecordRepository
 * ----------------------------------------
 * 对局记录仓储接口
 * - 终局时写入每名玩家的最终净值与分类明细；
 * - 按玩家读取最新记录，用于重建最终排行榜；
 * - 当前实现为 Redis。
 * ----------------------------------------
 */
public interface SessionRecordRepository {

    /**
     * 写入终局记录
     * @param roomCode 房间号
     * @param records  每名（非房主）玩家一条
     * @return 本次写入的 logId
     */
    String finalizeSession(String roomCode, List<SessionRecord> records);

    /**
     * 每名玩家最新的一条记录，按净值降序
     * @param roomCode 房间号
     */
    List<SessionRecord> readLatestByPlayer(String roomCode);
}
