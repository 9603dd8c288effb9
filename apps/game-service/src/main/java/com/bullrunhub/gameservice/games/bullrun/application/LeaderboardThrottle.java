package com.bullrunhub.gameservice.games.bullrun.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 排行榜广播合并：
 * 同一房间在窗口期内只保留一个待执行任务，后续请求直接合并；
 * 任务触发时再读取最新状态，所以最终状态不会丢。
 */
@Slf4j
@Component
public class LeaderboardThrottle {

    private final ScheduledExecutorService scheduler;
    private final long windowMs;

    /** roomCode -> 待执行的广播 */
    private final ConcurrentMap<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public LeaderboardThrottle(@Qualifier("broadcastScheduler") ScheduledExecutorService scheduler,
                               @Value("${bullrun.session.leaderboard-window-ms:2000}") long windowMs) {
        this.scheduler = scheduler;
        this.windowMs = windowMs;
    }

    /**
     * 请求一次广播。
     * @return true 表示新排了任务，false 表示并入了已有任务
     */
    public boolean request(String roomCode, Runnable broadcast) {
        boolean[] scheduled = {false};
        pending.computeIfAbsent(roomCode, code -> {
            scheduled[0] = true;
            return scheduler.schedule(() -> fire(code, broadcast), windowMs, TimeUnit.MILLISECONDS);
        });
        return scheduled[0];
    }

    private void fire(String roomCode, Runnable broadcast) {
        // 先移除再广播：广播期间到来的请求会排下一轮
        pending.remove(roomCode);
        try {
            broadcast.run();
        } catch (RuntimeException e) {
            log.warn("排行榜广播失败: room={}", roomCode, e);
        }
    }

    /** 房间结束或删除时取消待执行的广播 */
    public void cancel(String roomCode) {
        ScheduledFuture<?> f = pending.remove(roomCode);
        if (f != null) {
            f.cancel(false);
        }
    }

    public boolean isPending(String roomCode) {
        return pending.containsKey(roomCode);
    }
}
