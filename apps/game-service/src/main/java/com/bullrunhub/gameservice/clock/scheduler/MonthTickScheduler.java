package com.bullrunhub.gameservice.clock.scheduler;

/**
 * MonthTickScheduler
 * ---------------------------------------
 * 通用的“周期推进调度器”接口，完全独立于具体业务。
 *
 * 设计目标：
 *  - 以固定间隔触发 key 对应的回调（每个房间一个 key）；
 *  - 同一个 key 同时只存在一个任务，重复启动会替换旧任务；
 *  - 不关心暂停、价格、广播等业务细节，由上层协调器负责。
 */
public interface MonthTickScheduler {

    /**
     * TickHandler
     * ---------------------------------------
     * 每个周期调用一次。
     */
    interface TickHandler {
        /**
         * @param key 业务键（如 "bullrun:{roomCode}"）
         */
        void onTick(String key);
    }

    /**
     * 启动（或替换）指定 key 的周期任务。首帧在一个周期之后触发。
     * @param key      业务键
     * @param periodMs 周期（毫秒），必须大于 0
     * @param handler  回调
     * @return 任务句柄
     */
    TickHandle start(String key, long periodMs, TickHandler handler);

    /**
     * 停止指定 key 的任务（不打断正在执行的那一次）。
     * @param key 业务键
     */
    void stop(String key);

    /** 指定 key 是否有活跃任务 */
    boolean isActive(String key);

    /** 当前活跃任务数 */
    int activeCount();
}
