package com.bullrunhub.gameservice.games.bullrun.domain.valuation;

import java.util.Map;

/**
 * 服务端估值结果：总额 + 分类明细（cash / savings / fixedDeposits / gold / funds / stocks / crypto / commodities / reits）。
 */
public record Valuation(double total, Map<String, Double> breakdown) {
}
