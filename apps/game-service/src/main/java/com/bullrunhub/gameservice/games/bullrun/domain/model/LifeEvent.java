package com.bullrunhub.gameservice.games.bullrun.domain.model;

import com.bullrunhub.gameservice.games.bullrun.domain.enums.LifeEventType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 生活事件：在 (gameYear, gameMonth) 触发一次，amount 带符号（收益为正，损失为负）。
 * triggered 只会从 false 变为 true。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LifeEvent {
    private String id;
    private LifeEventType type;
    private String message;
    private double amount;
    private int gameYear;
    private int gameMonth;
    private boolean triggered;

    public boolean isDueAt(int year, int month) {
        return !triggered && gameYear == year && gameMonth == month;
    }

    public LifeEvent copy() {
        return new LifeEvent(id, type, message, amount, gameYear, gameMonth, triggered);
    }
}
