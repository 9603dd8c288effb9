package com.bullrunhub.gameservice.games.bullrun.domain.event;

import com.bullrunhub.gameservice.games.bullrun.domain.model.LifeEvent;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 生活事件生成器。可能失败，调用方需要隔离单个玩家的失败。
 */
public interface LifeEventGenerator {

    /**
     * @param count          事件数量
     * @param unlockSchedule 资产解锁时间表（透传，不解释）
     * @return 按 (year, month) 排序的事件
     */
    List<LifeEvent> generateLifeEvents(int count, JsonNode unlockSchedule);
}
