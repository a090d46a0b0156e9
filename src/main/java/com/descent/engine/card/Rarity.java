package com.descent.engine.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Rarity shared by cards, relics and potions.
 */
public enum Rarity {
    STARTER("STARTER"),
    COMMON("COMMON"),
    UNCOMMON("UNCOMMON"),
    RARE("RARE"),
    SPECIAL("SPECIAL");

    private final String jsonValue;

    Rarity(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static Rarity fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rarity cannot be null");
        }
        return switch (value.toUpperCase()) {
            case "STARTER" -> STARTER;
            case "COMMON" -> COMMON;
            case "UNCOMMON" -> UNCOMMON;
            case "RARE" -> RARE;
            // Boss relics are catalogued as special
            case "SPECIAL", "BOSS" -> SPECIAL;
            default -> throw new IllegalArgumentException("Unknown rarity: " + value);
        };
    }
}
