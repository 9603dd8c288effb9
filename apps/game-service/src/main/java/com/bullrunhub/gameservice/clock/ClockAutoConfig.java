package com.bullrunhub.gameservice.clock;

import com.bullrunhub.gameservice.clock.scheduler.MonthTickScheduler;
import com.bullrunhub.gameservice.clock.scheduler.MonthTickSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 把调度线程池注入到通用的月度推进引擎中。
 * 这里不关心任何业务细节，只负责把基础设施拼起来。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public MonthTickScheduler monthTickScheduler(@Qualifier("monthTickExecutor") ScheduledThreadPoolExecutor monthTickExecutor) {
        return new MonthTickSchedulerImpl(monthTickExecutor); // 纯引擎，无业务逻辑
    }
}
