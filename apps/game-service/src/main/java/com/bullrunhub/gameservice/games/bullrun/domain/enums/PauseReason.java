package com.bullrunhub.gameservice.games.bullrun.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 暂停原因。NONE 当且仅当未暂停。
 */
public enum PauseReason {
    NONE("none"),
    /** 答题屏障：等待列表清空前不可恢复 */
    QUIZ("quiz"),
    /** 房主手动暂停 */
    MANUAL("manual"),
    /** 开局介绍：等待所有玩家看完介绍 */
    INTRO("intro");

    private final String wire;

    PauseReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
