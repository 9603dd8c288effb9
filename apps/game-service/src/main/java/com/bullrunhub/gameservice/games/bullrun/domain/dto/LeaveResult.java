package com.bullrunhub.gameservice.games.bullrun.domain.dto;

/**
 * 离开房间的结果。
 * @param roomCode   玩家原所在房间，不在任何房间时为 null
 * @param wasHost    离开的是否是房主
 * @param roomClosed 房间是否因此被删除（房主离开或成员清空）
 * @param resumed    离开者是答题屏障上最后一个等待者，房间因此恢复推进
 */
public record LeaveResult(String roomCode, boolean wasHost, boolean roomClosed, boolean resumed) {

    public static final LeaveResult NOT_IN_ROOM = new LeaveResult(null, false, false, false);

    public boolean leftRoom() {
        return roomCode != null;
    }
}
