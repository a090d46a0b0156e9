package com.descent.engine.enemy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an enemy shows it is about to do.
 */
public enum IntentType {
    ATTACK,
    ATTACK_BUFF,
    ATTACK_DEBUFF,
    ATTACK_DEFEND,
    DEFEND,
    BUFF,
    DEBUFF,
    STRONG_DEBUFF,
    UNKNOWN;

    @JsonValue
    public String getJsonValue() {
        return name();
    }

    public boolean isAttack() {
        return switch (this) {
            case ATTACK, ATTACK_BUFF, ATTACK_DEBUFF, ATTACK_DEFEND -> true;
            default -> false;
        };
    }

    @JsonCreator
    public static IntentType fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown intent type: " + value, e);
        }
    }
}
