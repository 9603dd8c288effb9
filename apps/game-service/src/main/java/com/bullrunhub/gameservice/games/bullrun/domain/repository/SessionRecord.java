package com.bullrunhub.gameservice.games.bullrun.domain.repository;

import com.bullrunhub.gameservice.games.bullrun.domain.model.PortfolioBreakdown;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一名玩家在一局结束时的最终记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {
    private String logId;
    private String roomCode;
    private String playerId;
    private String playerName;
    private double finalNetworth;
    private PortfolioBreakdown portfolioBreakdown;
    private int finalYear;
    private int finalMonth;
    private long recordedAt;
}
