package com.bullrunhub.gameservice.games.bullrun.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 玩家资产分类汇总（客户端上报的展示缓存）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioBreakdown {
    private double cash;
    private double savings;
    private double fixedDeposits;
    private double gold;
    private double funds;
    private double stocks;
    private double crypto;
    private double commodities;
    private double reits;

    /** 只有现金的初始组合 */
    public static PortfolioBreakdown cashOnly(double cash) {
        PortfolioBreakdown b = new PortfolioBreakdown();
        b.setCash(cash);
        return b;
    }

    public PortfolioBreakdown copy() {
        return new PortfolioBreakdown(cash, savings, fixedDeposits, gold, funds, stocks, crypto, commodities, reits);
    }
}
