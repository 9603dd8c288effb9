package com.bullrunhub.gameservice.games.bullrun.domain.repository;

import com.bullrunhub.gameservice.games.bullrun.domain.model.PriceSnapshot;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * PriceSource
 * ----------------------------------------
 * 历史行情来源接口
 * - 按日历年月查询一组 symbol 的权威价格；
 * - 根据房主选择的资产配置计算本局涉及的 symbol；
 * - 当前实现为 PostgreSQL（MarketDataService）。
 * ----------------------------------------
 */
public interface PriceSource {

    /**
     * 查询某个日历年月的价格
     * @param symbols       symbol 列表
     * @param calendarYear  日历年（如 2005）
     * @param calendarMonth 1..12
     * @return 价格快照，查不到的 symbol 不出现在结果里
     */
    PriceSnapshot getPricesForDate(List<String> symbols, int calendarYear, int calendarMonth);

    /**
     * 本局需要的 symbol：固定的常驻 symbol + 配置选中的 symbol，去重且顺序确定
     * @param selectedAssets 透传的资产配置
     */
    List<String> getGameSymbols(JsonNode selectedAssets);

    /**
     * 预热整局价格，尽力而为，失败不影响正确性
     * @param symbols    symbol 列表
     * @param startYear  起始日历年
     * @param totalYears 总年数
     */
    void preloadPricesForGame(List<String> symbols, int startYear, int totalYears);
}
