package com.bullrunhub.gameservice.games.bullrun.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 历史价格 Repository（PostgreSQL 原生查询）
 */
@Repository
public interface AssetPriceRepository extends JpaRepository<AssetPrice, AssetPrice.Key> {

    /** symbol + 收盘价 */
    interface SymbolPrice {
        String getAssetName();
        Double getClosePrice();
    }

    /** 带年月的收盘价，用于按月预热 */
    interface MonthlyPrice {
        String getAssetName();
        Integer getPriceYear();
        Integer getPriceMonth();
        Double getClosePrice();
    }

    /**
     * 每个 symbol 取离目标日期最近的一条：优先目标日及之前，窗口为 [-60 天, +30 天]
     */
    @Query(value = """
            SELECT ranked.asset_name AS assetName, ranked.close_price AS closePrice
            FROM (
                SELECT asset_name, close_price,
                       ROW_NUMBER() OVER (
                           PARTITION BY asset_name
                           ORDER BY CASE WHEN date <= CAST(:target AS date) THEN 0 ELSE 1 END,
                                    ABS(date - CAST(:target AS date))
                       ) AS rn
                FROM asset_prices
                WHERE asset_name IN (:symbols)
                  AND date >= CAST(:target AS date) - INTERVAL '60 days'
                  AND date <= CAST(:target AS date) + INTERVAL '30 days'
            ) ranked
            WHERE ranked.rn = 1 AND ranked.close_price IS NOT NULL
            """, nativeQuery = true)
    List<SymbolPrice> findClosestPrices(@Param("target") LocalDate target,
                                        @Param("symbols") Collection<String> symbols);

    /**
     * 实物黄金一律使用人民币换算表（每 10 克）
     */
    @Query(value = """
            SELECT close_inr_per_10g FROM physical_gold_inr
            WHERE date <= CAST(:target AS date) AND close_inr_per_10g IS NOT NULL
            ORDER BY date DESC LIMIT 1
            """, nativeQuery = true)
    Optional<Double> findPhysicalGoldPrice(@Param("target") LocalDate target);

    /**
     * 区间内所有日线（按日期升序），同月的后一条覆盖前一条
     */
    @Query(value = """
            SELECT asset_name AS assetName,
                   CAST(EXTRACT(YEAR FROM date) AS int) AS priceYear,
                   CAST(EXTRACT(MONTH FROM date) AS int) AS priceMonth,
                   close_price AS closePrice
            FROM asset_prices
            WHERE asset_name IN (:symbols) AND date >= :start AND date <= :end
              AND close_price IS NOT NULL
            ORDER BY date
            """, nativeQuery = true)
    List<MonthlyPrice> findPricesBetween(@Param("symbols") Collection<String> symbols,
                                         @Param("start") LocalDate start,
                                         @Param("end") LocalDate end);

    @Query(value = """
            SELECT 'Physical_Gold' AS assetName,
                   CAST(EXTRACT(YEAR FROM date) AS int) AS priceYear,
                   CAST(EXTRACT(MONTH FROM date) AS int) AS priceMonth,
                   close_inr_per_10g AS closePrice
            FROM physical_gold_inr
            WHERE date >= :start AND date <= :end AND close_inr_per_10g IS NOT NULL
            ORDER BY date
            """, nativeQuery = true)
    List<MonthlyPrice> findPhysicalGoldBetween(@Param("start") LocalDate start,
                                               @Param("end") LocalDate end);
}
