package com.bullrunhub.gameservice.games.bullrun.domain.valuation;

import com.bullrunhub.gameservice.games.bullrun.domain.model.PriceSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 服务端权威估值（反作弊）。
 *
 * 纯函数、无副作用：同样的输入永远得到同样的结果。
 * 价格缺失按 0 计，不会跳过该持仓。
 */
@Component
public class NetworthCalculator {

    /** 允许的相对偏差（百分比） */
    public static final double TOLERANCE_PERCENT = 0.5;

    public static final String PHYSICAL_GOLD = "Physical_Gold";
    public static final String DIGITAL_GOLD = "Digital_Gold";

    public Valuation calculateServerNetworth(double cash,
                                             double savingsBalance,
                                             List<FixedDeposit> fixedDeposits,
                                             Holdings holdings,
                                             PriceSnapshot prices,
                                             JsonNode selectedAssets,
                                             int currentYear,
                                             int currentMonth) {
        Holdings h = holdings == null ? new Holdings() : holdings;
        PriceSnapshot p = prices == null ? PriceSnapshot.EMPTY : prices;
        Map<String, Double> breakdown = new LinkedHashMap<>();

        breakdown.put("cash", cash);
        breakdown.put("savings", savingsBalance);
        breakdown.put("fixedDeposits", fixedDepositsValue(fixedDeposits, currentYear, currentMonth));

        breakdown.put("gold", qty(h.getPhysicalGold()) * p.priceOrZero(PHYSICAL_GOLD)
                + qty(h.getDigitalGold()) * p.priceOrZero(DIGITAL_GOLD));

        // 指数基金和共同基金都按所选基金的价格估值
        double fundPrice = p.priceOrZero(text(selectedAssets, "fundName"));
        breakdown.put("funds", (qty(h.getIndexFund()) + qty(h.getMutualFund())) * fundPrice);

        breakdown.put("stocks", bySymbol(h.getStocks(), p));
        breakdown.put("crypto", bySymbol(h.getCrypto(), p));

        breakdown.put("commodities", qty(h.getCommodity()) * p.priceOrZero(text(selectedAssets, "commodity")));
        breakdown.put("reits", bySymbol(h.getReits(), p));

        double total = 0;
        for (double v : breakdown.values()) {
            total += v;
        }
        return new Valuation(total, Collections.unmodifiableMap(breakdown));
    }

    /**
     * 定期存款估值：
     * - 已到期：本金 × (1 + 年利率/100 × 年限)
     * - 未到期：本金 + 利息 × (已过整月数 / 总月数)，已过月数夹到 [0, duration]
     */
    public double fixedDepositsValue(List<FixedDeposit> fixedDeposits, int currentYear, int currentMonth) {
        if (fixedDeposits == null) {
            return 0;
        }
        double sum = 0;
        for (FixedDeposit fd : fixedDeposits) {
            double totalReturn = fd.getInterestRate() / 100 * (fd.getDuration() / 12.0);
            if (fd.isMatured()) {
                sum += fd.getAmount() * (1 + totalReturn);
            } else if (fd.getDuration() <= 0) {
                sum += fd.getAmount();
            } else {
                int elapsed = (currentYear - fd.getStartYear()) * 12 + (currentMonth - fd.getStartMonth());
                elapsed = Math.max(0, Math.min(elapsed, fd.getDuration()));
                double progress = (double) elapsed / fd.getDuration();
                sum += fd.getAmount() + fd.getAmount() * totalReturn * progress;
            }
        }
        return sum;
    }

    /**
     * 偏差 = |client - server| / |server| × 100。
     * server 为 0 时：client 也为 0 视为通过，否则偏差记为 100。
     */
    public NetworthValidation validateNetworth(double clientNetworth, double serverNetworth) {
        if (serverNetworth == 0 && clientNetworth == 0) {
            return new NetworthValidation(true, 0, 0, 0, Map.of());
        }
        double deviation = serverNetworth != 0
                ? Math.abs(clientNetworth - serverNetworth) / Math.abs(serverNetworth) * 100
                : 100;
        return new NetworthValidation(deviation <= TOLERANCE_PERCENT, serverNetworth, clientNetworth, deviation, Map.of());
    }

    /** 估值 + 校验，结果附带分类明细 */
    public NetworthValidation fullValidation(double clientNetworth,
                                             double cash,
                                             double savingsBalance,
                                             List<FixedDeposit> fixedDeposits,
                                             Holdings holdings,
                                             PriceSnapshot prices,
                                             JsonNode selectedAssets,
                                             int currentYear,
                                             int currentMonth) {
        Valuation v = calculateServerNetworth(cash, savingsBalance, fixedDeposits, holdings, prices,
                selectedAssets, currentYear, currentMonth);
        NetworthValidation r = validateNetworth(clientNetworth, v.total());
        return new NetworthValidation(r.valid(), r.serverNetworth(), r.clientNetworth(), r.deviation(), v.breakdown());
    }

    private static double bySymbol(Map<String, AssetHolding> holdings, PriceSnapshot prices) {
        if (holdings == null) {
            return 0;
        }
        double sum = 0;
        for (Map.Entry<String, AssetHolding> e : holdings.entrySet()) {
            double q = qty(e.getValue());
            if (q > 0) {
                sum += q * prices.priceOrZero(e.getKey());
            }
        }
        return sum;
    }

    private static double qty(AssetHolding holding) {
        return holding == null ? 0 : holding.getQuantity();
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        return node.get(field).asText();
    }
}
