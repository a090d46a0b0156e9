package com.descent.engine.card;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One declarative effect: a kind, a magnitude and optional overrides.
 *
 * @param type   effect kind
 * @param value  magnitude (damage, block, stacks, card count...)
 * @param target explicit target override, or null to use the owner's default
 * @param times  number of repetitions, at least 1
 * @param cardId card template referenced by card-generating effects
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Effect(
        @JsonProperty("type") EffectType type,
        @JsonProperty("value") int value,
        @JsonProperty("target") TargetType target,
        @JsonProperty("times") int times,
        @JsonProperty("card_id") String cardId
) {
    public Effect {
        if (type == null) {
            throw new IllegalArgumentException("Effect type cannot be null");
        }
        if (times <= 0) {
            times = 1;
        }
    }

    public static Effect of(EffectType type, int value) {
        return new Effect(type, value, null, 1, null);
    }

    public static Effect of(EffectType type, int value, TargetType target) {
        return new Effect(type, value, target, 1, null);
    }

    public static Effect multiHit(EffectType type, int value, int times) {
        return new Effect(type, value, null, times, null);
    }

    public static Effect withCard(EffectType type, int count, String cardId) {
        return new Effect(type, count, null, 1, cardId);
    }

    public Effect withValue(int newValue) {
        return new Effect(type, newValue, target, times, cardId);
    }

    public Effect withTimes(int newTimes) {
        return new Effect(type, value, target, newTimes, cardId);
    }
}
