package com.bullrunhub.gameservice.clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 月度推进线程池配置类，统一创建全局的 ScheduledThreadPoolExecutor。
 *
 * 功能说明：
 * 1. 从配置文件读取核心线程数（scheduler.clock.corePoolSize）；
 * 2. 自定义线程工厂，线程命名为 month-tick-N，便于调试；
 * 3. 设置为守护线程，JVM 退出时自动结束；
 * 4. 启用 setRemoveOnCancelPolicy(true)，房间结束后任务从队列中移除。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "monthTickExecutor", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor monthTickExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "month-tick-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.AbortPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
