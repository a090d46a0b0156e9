package com.descent.engine.enemy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enemy tiers.
 */
public enum EnemyType {
    NORMAL("normal"),
    ELITE("elite"),
    BOSS("boss");

    private final String jsonValue;

    EnemyType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static EnemyType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Enemy type cannot be null");
        }
        return switch (value.toLowerCase()) {
            case "normal" -> NORMAL;
            case "elite" -> ELITE;
            case "boss" -> BOSS;
            default -> throw new IllegalArgumentException("Unknown enemy type: " + value);
        };
    }
}
