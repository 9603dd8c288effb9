package com.bullrunhub.gameservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 这个调度器专门用于排行榜的合并广播（延迟 2 秒的尾部发送），与月度推进的调度器分开，
 * 避免广播突发挤占推进线程、影响时间线的准时性。
 */
@Configuration
public class BroadcastSchedulerConfig {

	@Value("${scheduler.broadcast.corePoolSize:2}")
	private int corePoolSize;

	@Bean(name = "broadcastScheduler", destroyMethod = "shutdownNow")
	public ScheduledExecutorService broadcastScheduler() {
		ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(Math.max(1, corePoolSize), new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "broadcast-" + idx.getAndIncrement());
                // 设置为守护线程
				t.setDaemon(true);
				return t;
			}
		});
		exec.setRemoveOnCancelPolicy(true);
		return exec;
	}
}
