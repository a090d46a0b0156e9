package com.descent.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Card types.
 */
public enum CardType {
    ATTACK("ATTACK"),
    SKILL("SKILL"),
    POWER("POWER"),
    STATUS("STATUS"),
    CURSE("CURSE");

    private final String jsonValue;

    CardType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Status and curse cards clog the deck rather than help the player.
     */
    public boolean isJunk() {
        return this == STATUS || this == CURSE;
    }

    @JsonCreator
    public static CardType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type cannot be null");
        }
        return switch (value.toUpperCase()) {
            case "ATTACK" -> ATTACK;
            case "SKILL" -> SKILL;
            case "POWER" -> POWER;
            case "STATUS" -> STATUS;
            case "CURSE" -> CURSE;
            default -> throw new IllegalArgumentException("Unknown card type: " + value);
        };
    }
}
