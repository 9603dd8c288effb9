package com.bullrunhub.gameservice.games.bullrun.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 房间内玩家信息。networth 与 portfolioBreakdown 是最近一次上报值（加上服务端生活事件的增量）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerInfo {
    private String id;
    private String name;
    private boolean host;
    private boolean ready;
    private double networth;
    private PortfolioBreakdown portfolioBreakdown = new PortfolioBreakdown();
    private QuizStatus quizStatus = new QuizStatus();

    public static PlayerInfo host(String id, String name) {
        return new PlayerInfo(id, name, true, false, 0, new PortfolioBreakdown(), new QuizStatus());
    }

    public static PlayerInfo joiner(String id, String name, double startingCash) {
        return new PlayerInfo(id, name, false, false, startingCash, PortfolioBreakdown.cashOnly(startingCash), new QuizStatus());
    }

    public PlayerInfo copy() {
        return new PlayerInfo(id, name, host, ready, networth,
                portfolioBreakdown == null ? null : portfolioBreakdown.copy(),
                quizStatus == null ? null : quizStatus.copy());
    }
}
