package com.descent.engine.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The twelve status keys a combatant can carry.
 * DURATION statuses reapply with max(existing, new); MAGNITUDE statuses add.
 */
public enum StatusEffect {
    STRENGTH("strength", Stacking.MAGNITUDE, true, false),
    DEXTERITY("dexterity", Stacking.MAGNITUDE, true, false),
    ARTIFACT("artifact", Stacking.MAGNITUDE, false, false),
    PLATED_ARMOR("plated_armor", Stacking.MAGNITUDE, false, false),
    THORNS("thorns", Stacking.MAGNITUDE, false, false),
    RITUAL("ritual", Stacking.MAGNITUDE, false, false),
    INTANGIBLE("intangible", Stacking.DURATION, false, false),
    REGEN("regen", Stacking.MAGNITUDE, false, false),
    WEAK("weak", Stacking.DURATION, false, true),
    VULNERABLE("vulnerable", Stacking.DURATION, false, true),
    FRAIL("frail", Stacking.DURATION, false, true),
    POISON("poison", Stacking.MAGNITUDE, false, true);

    /**
     * How a reapplication combines with the existing value.
     */
    public enum Stacking {
        DURATION,
        MAGNITUDE
    }

    private final String jsonValue;
    private final Stacking stacking;
    private final boolean signed;
    private final boolean debuff;

    StatusEffect(String jsonValue, Stacking stacking, boolean signed, boolean debuff) {
        this.jsonValue = jsonValue;
        this.stacking = stacking;
        this.signed = signed;
        this.debuff = debuff;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public Stacking getStacking() {
        return stacking;
    }

    /**
     * Strength and dexterity may go negative; everything else floors at 0.
     */
    public boolean isSigned() {
        return signed;
    }

    public boolean isDebuff() {
        return debuff;
    }

    @JsonCreator
    public static StatusEffect fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Status effect cannot be null");
        }
        String key = value.replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase();
        for (StatusEffect effect : values()) {
            if (effect.jsonValue.equals(key)) {
                return effect;
            }
        }
        throw new IllegalArgumentException("Unknown status effect: " + value);
    }
}
