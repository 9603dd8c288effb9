package com.bullrunhub.gameservice.clock.scheduler;

/**
 * 周期任务句柄。房间只持有它，不关心背后是哪种调度实现。
 */
public interface TickHandle {

    /** 取消任务（不打断正在执行的那一次） */
    void cancel();

    /** 是否已取消 */
    boolean isCancelled();
}
