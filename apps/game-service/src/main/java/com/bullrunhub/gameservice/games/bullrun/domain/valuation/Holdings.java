package com.bullrunhub.gameservice.games.bullrun.domain.valuation;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 玩家持仓（数量），估值时乘以权威价格。
 */
@Data
public class Holdings {
    private AssetHolding physicalGold;
    private AssetHolding digitalGold;
    private AssetHolding indexFund;
    private AssetHolding mutualFund;
    /** symbol -> 持仓 */
    private Map<String, AssetHolding> stocks = new LinkedHashMap<>();
    private Map<String, AssetHolding> crypto = new LinkedHashMap<>();
    private AssetHolding commodity;
    private Map<String, AssetHolding> reits = new LinkedHashMap<>();
}
