package com.descent.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who an effect lands on.
 */
public enum TargetType {
    SELF("SELF"),
    SINGLE_ENEMY("SINGLE_ENEMY"),
    ALL_ENEMIES("ALL_ENEMIES"),
    RANDOM_ENEMY("RANDOM_ENEMY");

    private final String jsonValue;

    TargetType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Only SINGLE_ENEMY needs the caller to pick a target.
     */
    public boolean requiresTarget() {
        return this == SINGLE_ENEMY;
    }

    @JsonCreator
    public static TargetType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Target type cannot be null");
        }
        return switch (value.toUpperCase()) {
            case "SELF", "NONE" -> SELF;
            case "SINGLE_ENEMY", "ENEMY" -> SINGLE_ENEMY;
            case "ALL_ENEMIES", "ALL_ENEMY" -> ALL_ENEMIES;
            case "RANDOM_ENEMY", "RANDOM" -> RANDOM_ENEMY;
            default -> throw new IllegalArgumentException("Unknown target type: " + value);
        };
    }
}
