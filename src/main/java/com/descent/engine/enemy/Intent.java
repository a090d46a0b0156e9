package com.descent.engine.enemy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Displayed intent of a move.
 *
 * @param type  intent kind
 * @param value base damage per hit for attacks, otherwise informational
 * @param times hits per attack, at least 1
 */
public record Intent(
        @JsonProperty("type") IntentType type,
        @JsonProperty("value") int value,
        @JsonProperty("times") int times
) {
    public Intent {
        if (type == null) {
            type = IntentType.UNKNOWN;
        }
        if (times <= 0) {
            times = 1;
        }
    }

    public static Intent attack(int value) {
        return new Intent(IntentType.ATTACK, value, 1);
    }

    public static Intent of(IntentType type) {
        return new Intent(type, 0, 1);
    }
}
