package com.descent.engine.relic;

import java.util.Optional;

/**
 * What a relic does when its trigger fires.
 */
public enum RelicAction {
    // Direct
    HEAL(Kind.DIRECT, 0),
    HEAL_PERCENT(Kind.DIRECT, 0),
    BLOCK(Kind.DIRECT, 0),
    DRAW(Kind.DIRECT, 0),
    GAIN_ENERGY(Kind.DIRECT, 0),
    GAIN_STRENGTH(Kind.DIRECT, 0),
    GAIN_DEXTERITY(Kind.DIRECT, 0),
    GAIN_MAX_HP(Kind.DIRECT, 0),
    GAIN_GOLD(Kind.DIRECT, 0),
    THORNS(Kind.DIRECT, 0),
    DAMAGE_RANDOM(Kind.DIRECT, 0),
    DAMAGE_ALL(Kind.DIRECT, 0),
    APPLY_VULNERABLE(Kind.DIRECT, 0),
    APPLY_WEAK(Kind.DIRECT, 0),
    PLATED_ARMOR(Kind.DIRECT, 0),

    // Every N: value is N, payload defaults below
    DRAW_EVERY_N(Kind.COUNTER, 1),
    ENERGY_EVERY_N(Kind.COUNTER, 2),
    STRENGTH_EVERY_N(Kind.COUNTER, 1),
    DEXTERITY_EVERY_N(Kind.COUNTER, 1),
    BLOCK_EVERY_N(Kind.COUNTER, 4),
    DAMAGE_ALL_EVERY_N(Kind.COUNTER, 5),

    // Passive
    RETAIN_BLOCK(Kind.PASSIVE, 0),
    POTION_SLOT(Kind.PASSIVE, 0),
    ENERGY_NEXT_COMBAT(Kind.PASSIVE, 0);

    public enum Kind {
        DIRECT,
        COUNTER,
        PASSIVE
    }

    private final Kind kind;
    private final int defaultPayload;

    RelicAction(Kind kind, int defaultPayload) {
        this.kind = kind;
        this.defaultPayload = defaultPayload;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isCounter() {
        return kind == Kind.COUNTER;
    }

    /**
     * Amount a counter action applies when it fires.
     */
    public int getDefaultPayload() {
        return defaultPayload;
    }

    /**
     * Actions that need enemies, piles or energy to exist.
     */
    public boolean requiresCombat() {
        return switch (this) {
            case HEAL, HEAL_PERCENT, GAIN_MAX_HP, GAIN_GOLD, RETAIN_BLOCK, POTION_SLOT, ENERGY_NEXT_COMBAT -> false;
            default -> true;
        };
    }

    public static Optional<RelicAction> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toUpperCase();
        // Legacy spellings
        key = switch (key) {
            case "ENERGY" -> "GAIN_ENERGY";
            case "STRENGTH" -> "GAIN_STRENGTH";
            case "DEXTERITY" -> "GAIN_DEXTERITY";
            case "MAX_HP" -> "GAIN_MAX_HP";
            case "GOLD" -> "GAIN_GOLD";
            default -> key;
        };
        for (RelicAction action : values()) {
            if (action.name().equals(key)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
