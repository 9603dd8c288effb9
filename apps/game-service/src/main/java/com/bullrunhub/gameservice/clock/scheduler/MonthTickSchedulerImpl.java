package com.bullrunhub.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * MonthTickSchedulerImpl
 * ---------------------------------------
 * 通用周期推进引擎的默认实现。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 按固定间隔调度；
 *  - 维护 key -> 任务句柄，支持替换与停止；
 *  - 回调抛出的异常只记录日志，不影响后续周期。
 *
 * 不做的事：
 *  - 不做任何业务逻辑（如暂停判断、广播、结束判定）。
 *  - 不做持久化：房间状态全部在内存中，进程重启即结束所有对局。
 */
public class MonthTickSchedulerImpl implements MonthTickScheduler {

    private static final Logger log = LoggerFactory.getLogger(MonthTickSchedulerImpl.class);

    private final ScheduledThreadPoolExecutor scheduler;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    public MonthTickSchedulerImpl(ScheduledThreadPoolExecutor scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public TickHandle start(String key, long periodMs, TickHandler handler) {
        if (periodMs <= 0) {
            throw new IllegalArgumentException("periodMs must be positive: " + periodMs);
        }
        // 防止重复任务：先取消老任务
        stop(key);
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(
                () -> safeTick(key, handler),
                periodMs,
                periodMs,
                TimeUnit.MILLISECONDS);
        activeTasks.put(key, fut);
        log.info("周期任务已启动: key={}, periodMs={}", key, periodMs);
        return new FutureTickHandle(key, fut);
    }

    @Override
    public void stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        if (f != null) {
            f.cancel(false);
            log.info("周期任务已停止: key={}", key);
        }
    }

    @Override
    public boolean isActive(String key) {
        ScheduledFuture<?> f = activeTasks.get(key);
        return f != null && !f.isCancelled();
    }

    @Override
    public int activeCount() {
        return activeTasks.size();
    }

    /**
     * 回调包装：异常会让 scheduleAtFixedRate 静默停止后续执行，所以这里兜住并记录。
     */
    private void safeTick(String key, TickHandler handler) {
        try {
            handler.onTick(key);
        } catch (RuntimeException e) {
            log.error("周期回调异常: key={}", key, e);
        }
    }

    /**
     * 句柄只取消自己创建的那一个任务，不会误伤同 key 上后来替换进来的新任务。
     */
    private final class FutureTickHandle implements TickHandle {
        private final String key;
        private final ScheduledFuture<?> future;

        private FutureTickHandle(String key, ScheduledFuture<?> future) {
            this.key = key;
            this.future = future;
        }

        @Override
        public void cancel() {
            activeTasks.remove(key, future);
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
