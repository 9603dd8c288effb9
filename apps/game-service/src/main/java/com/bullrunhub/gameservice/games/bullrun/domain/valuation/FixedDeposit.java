package com.bullrunhub.gameservice.games.bullrun.domain.valuation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 定期存款。duration 单位为月，interestRate 为年化百分比（7.0 表示 7%）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixedDeposit {
    private String id;
    private double amount;
    private int duration;
    private double interestRate;
    private int startYear;
    private int startMonth;
    private boolean matured;
}
