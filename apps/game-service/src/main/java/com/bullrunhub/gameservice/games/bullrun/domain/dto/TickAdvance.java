package com.bullrunhub.gameservice.games.bullrun.domain.dto;

/**
 * 一次时钟推进的结果。year/month 为推进后（FINISHED 时为终局）的模拟年月。
 */
public record TickAdvance(Status status, int year, int month) {

    public enum Status {
        /** 房间已不存在 */
        ROOM_MISSING,
        /** 未开始或已结束 */
        NOT_RUNNING,
        /** 暂停中，本次不推进 */
        PAUSED,
        /** 正常推进一个月 */
        ADVANCED,
        /** 本次推进越过总年限，房间已标记结束 */
        FINISHED
    }

    public static TickAdvance of(Status status) {
        return new TickAdvance(status, 0, 0);
    }
}
