package com.descent.engine.relic;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When a relic's "every N" counter is zeroed besides firing.
 */
public enum CounterReset {
    NEVER("NEVER"),
    COMBAT("COMBAT"),
    TURN("TURN");

    private final String jsonValue;

    CounterReset(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static CounterReset fromString(String value) {
        if (value == null) {
            return NEVER;
        }
        return switch (value.toUpperCase()) {
            case "NEVER", "NONE" -> NEVER;
            case "COMBAT" -> COMBAT;
            case "TURN" -> TURN;
            default -> throw new IllegalArgumentException("Unknown counter reset: " + value);
        };
    }
}
