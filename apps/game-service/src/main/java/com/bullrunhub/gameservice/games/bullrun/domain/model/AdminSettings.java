package com.bullrunhub.gameservice.games.bullrun.domain.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 房主配置。开局后冻结，不再允许修改。
 */
@Data
public class AdminSettings {

    public static final int MIN_EVENTS = 1;
    public static final int MAX_EVENTS = 20;

    private List<String> selectedCategories = new ArrayList<>(
            List.of("BANKING", "GOLD", "STOCKS", "FUNDS", "CRYPTO", "REIT", "COMMODITIES"));
    private Integer gameStartYear = 2005;
    private boolean hideCurrentYear;
    private double initialPocketCash = 100000;
    /** 每 6 个月发放一次 */
    private double recurringIncome = 50000;
    private boolean enableQuiz = true;
    private Integer eventsCount;
    /** 每个模拟月的毫秒数 */
    private Long monthDuration;
    private boolean showIntro;

    /** 生活事件数量，未配置用默认值，并夹到 [1, 20] */
    public int resolveEventsCount(int fallback) {
        int n = eventsCount == null ? fallback : eventsCount;
        return Math.max(MIN_EVENTS, Math.min(MAX_EVENTS, n));
    }

    public long resolveMonthDuration(long fallback) {
        return monthDuration == null || monthDuration <= 0 ? fallback : monthDuration;
    }

    public AdminSettings copy() {
        AdminSettings c = new AdminSettings();
        c.setSelectedCategories(selectedCategories == null ? null : new ArrayList<>(selectedCategories));
        c.setGameStartYear(gameStartYear);
        c.setHideCurrentYear(hideCurrentYear);
        c.setInitialPocketCash(initialPocketCash);
        c.setRecurringIncome(recurringIncome);
        c.setEnableQuiz(enableQuiz);
        c.setEventsCount(eventsCount);
        c.setMonthDuration(monthDuration);
        c.setShowIntro(showIntro);
        return c;
    }
}
