package com.bullrunhub.gameservice.games.bullrun.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 某个模拟月份的权威价格：symbol -> price。
 */
public record PriceSnapshot(Map<String, Double> prices) {

    public static final PriceSnapshot EMPTY = new PriceSnapshot(Map.of());

    public PriceSnapshot {
        prices = Collections.unmodifiableMap(new LinkedHashMap<>(prices));
    }

    public Double get(String symbol) {
        return prices.get(symbol);
    }

    /** 缺失的价格按 0 计 */
    public double priceOrZero(String symbol) {
        if (symbol == null) {
            return 0;
        }
        Double p = prices.get(symbol);
        return p == null ? 0 : p;
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    public int size() {
        return prices.size();
    }
}
