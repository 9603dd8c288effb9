package com.bullrunhub.gameservice.games.bullrun.domain.dto;

import com.bullrunhub.gameservice.games.bullrun.domain.model.LifeEvent;

/**
 * 本月触发的生活事件，只推送给 playerId 本人。
 * @param postPocketCash 应用增量后的现金
 */
public record TriggeredLifeEvent(String playerId, LifeEvent event, double postPocketCash) {
}
