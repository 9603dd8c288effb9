package com.bullrunhub.gameservice.games.bullrun.infrastructure.market;

import com.bullrunhub.gameservice.games.bullrun.domain.model.PriceSnapshot;
import com.bullrunhub.gameservice.games.bullrun.domain.repository.PriceSource;
import com.bullrunhub.gameservice.games.bullrun.infrastructure.persistence.AssetPriceRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 历史行情服务（PostgreSQL）。
 *
 * 缓存：key 为 "YYYY-MM"，容量有上限，满了淘汰最早写入的一条；
 * 只在所有请求的 symbol 都已缓存时直接命中，否则回库补齐。
 */
@Slf4j
@Service
public class MarketDataService implements PriceSource {

    public static final String PHYSICAL_GOLD = "Physical_Gold";
    public static final String DIGITAL_GOLD = "Digital_Gold";

    /** 固定常驻的 symbol */
    static final List<String> CRYPTO = List.of("BTC", "ETH");
    static final List<String> REITS = List.of("EMBASSY", "MINDSPACE");

    private final AssetPriceRepository repository;
    private final int cacheMaxSize;

    // 插入顺序即淘汰顺序
    private final LinkedHashMap<String, Map<String, Double>> cache = new LinkedHashMap<>();

    public MarketDataService(AssetPriceRepository repository,
                             @Value("${bullrun.market.cache-max-size:300}") int cacheMaxSize) {
        this.repository = repository;
        this.cacheMaxSize = Math.max(1, cacheMaxSize);
    }

    @Override
    public PriceSnapshot getPricesForDate(List<String> symbols, int calendarYear, int calendarMonth) {
        String cacheKey = cacheKey(calendarYear, calendarMonth);
        Map<String, Double> cached = cacheGet(cacheKey);
        if (cached != null && cached.keySet().containsAll(symbols)) {
            return filter(cached, symbols);
        }

        LocalDate target = LocalDate.of(calendarYear, calendarMonth, 1);
        Map<String, Double> snapshot = cached == null ? new HashMap<>() : new HashMap<>(cached);
        if (!symbols.isEmpty()) {
            repository.findClosestPrices(target, symbols).forEach(row -> {
                if (row.getClosePrice() != null) {
                    snapshot.put(row.getAssetName(), row.getClosePrice());
                }
            });
        }
        // 实物黄金一律以换算表为准，覆盖 asset_prices 里可能存在的美元价
        if (symbols.contains(PHYSICAL_GOLD)) {
            repository.findPhysicalGoldPrice(target).ifPresent(p -> snapshot.put(PHYSICAL_GOLD, p));
        }
        cachePut(cacheKey, snapshot);
        return filter(snapshot, symbols);
    }

    @Override
    public void preloadPricesForGame(List<String> symbols, int startYear, int totalYears) {
        long t0 = System.currentTimeMillis();
        LocalDate start = LocalDate.of(startYear, 1, 1);
        LocalDate end = LocalDate.of(startYear + totalYears, 12, 31);

        Map<String, Map<String, Double>> monthly = new LinkedHashMap<>();
        if (!symbols.isEmpty()) {
            repository.findPricesBetween(symbols, start, end).forEach(row -> monthly
                    .computeIfAbsent(cacheKey(row.getPriceYear(), row.getPriceMonth()), k -> new HashMap<>())
                    .put(row.getAssetName(), row.getClosePrice()));
        }
        if (symbols.contains(PHYSICAL_GOLD)) {
            repository.findPhysicalGoldBetween(start, end).forEach(row -> monthly
                    .computeIfAbsent(cacheKey(row.getPriceYear(), row.getPriceMonth()), k -> new HashMap<>())
                    .put(PHYSICAL_GOLD, row.getClosePrice()));
        }
        monthly.forEach(this::cachePut);
        log.info("行情预热完成: symbols={}, years={}..{}, months={}, costMs={}",
                symbols.size(), startYear, startYear + totalYears, monthly.size(), System.currentTimeMillis() - t0);
    }

    /**
     * 黄金（实物 + 数字）、所选基金、所选股票、BTC/ETH、所选大宗商品、两只 REIT；去重并保持顺序。
     */
    @Override
    public List<String> getGameSymbols(JsonNode selectedAssets) {
        Set<String> symbols = new LinkedHashSet<>();
        symbols.add(PHYSICAL_GOLD);
        symbols.add(DIGITAL_GOLD);
        addText(symbols, selectedAssets, "fundName");
        if (selectedAssets != null && selectedAssets.path("stocks").isArray()) {
            selectedAssets.path("stocks").forEach(n -> {
                if (n.isTextual() && StringUtils.isNotBlank(n.asText())) {
                    symbols.add(n.asText());
                }
            });
        }
        symbols.addAll(CRYPTO);
        addText(symbols, selectedAssets, "commodity");
        symbols.addAll(REITS);
        return new ArrayList<>(symbols);
    }

    public int cacheSize() {
        synchronized (cache) {
            return cache.size();
        }
    }

    public void clearCache() {
        synchronized (cache) {
            cache.clear();
        }
    }

    // ---------------- helpers ----------------

    static String cacheKey(int year, int month) {
        return String.format("%d-%02d", year, month);
    }

    private Map<String, Double> cacheGet(String key) {
        synchronized (cache) {
            return cache.get(key);
        }
    }

    private void cachePut(String key, Map<String, Double> snapshot) {
        synchronized (cache) {
            if (!cache.containsKey(key) && cache.size() >= cacheMaxSize) {
                String oldest = cache.keySet().iterator().next();
                cache.remove(oldest);
            }
            cache.put(key, Map.copyOf(snapshot));
        }
    }

    private static PriceSnapshot filter(Map<String, Double> snapshot, List<String> symbols) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String s : symbols) {
            Double p = snapshot.get(s);
            if (p != null) {
                out.put(s, p);
            }
        }
        return new PriceSnapshot(out);
    }

    private static void addText(Set<String> symbols, JsonNode node, String field) {
        if (node != null && node.hasNonNull(field) && StringUtils.isNotBlank(node.get(field).asText())) {
            symbols.add(node.get(field).asText());
        }
    }
}
