package com.bullrunhub.gameservice.games.bullrun.application;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 对局相关配置（bullrun.session.*）。
 */
@Getter
@Component
public class SessionSettings {

    /** 房主未配置 monthDuration 时每个模拟月的毫秒数 */
    private final long defaultMonthDurationMs;
    /** 总年数，超过即终局 */
    private final int totalYears;
    /** 房主未配置 eventsCount 时每名玩家的生活事件数 */
    private final int defaultEventsCount;

    public SessionSettings(@Value("${bullrun.session.default-month-duration-ms:5000}") long defaultMonthDurationMs,
                           @Value("${bullrun.session.total-years:20}") int totalYears,
                           @Value("${bullrun.session.default-events-count:3}") int defaultEventsCount) {
        this.defaultMonthDurationMs = defaultMonthDurationMs;
        this.totalYears = totalYears;
        this.defaultEventsCount = defaultEventsCount;
    }
}
