package com.bullrunhub.gameservice.games.bullrun.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LifeEventType {
    GAIN("gain"),
    LOSS("loss");

    private final String wire;

    LifeEventType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
