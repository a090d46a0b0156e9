package com.descent.engine.combat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Status counters of one combatant.
 * Absent keys read as 0.
 */
public class StatusBag {
    private final EnumMap<StatusEffect, Integer> values = new EnumMap<>(StatusEffect.class);

    public int get(StatusEffect effect) {
        return values.getOrDefault(effect, 0);
    }

    public boolean has(StatusEffect effect) {
        return get(effect) != 0;
    }

    /**
     * Apply an amount using the status's stacking rule.
     * Duration statuses take max(existing, amount); magnitude statuses add.
     * @return the new value
     */
    public int apply(StatusEffect effect, int amount) {
        int current = get(effect);
        int next = effect.getStacking() == StatusEffect.Stacking.DURATION
                ? Math.max(current, amount)
                : current + amount;
        return set(effect, next);
    }

    /**
     * Overwrite a value, flooring unsigned statuses at 0.
     * @return the stored value
     */
    public int set(StatusEffect effect, int value) {
        int stored = effect.isSigned() ? value : Math.max(0, value);
        if (stored == 0) {
            values.remove(effect);
        } else {
            values.put(effect, stored);
        }
        return stored;
    }

    /**
     * Decrement by one, never below 0.
     */
    public void decrement(StatusEffect effect) {
        int current = get(effect);
        if (current > 0) {
            set(effect, current - 1);
        }
    }

    public void clear() {
        values.clear();
    }

    /**
     * Unmodifiable snapshot of the non-zero statuses.
     */
    public Map<StatusEffect, Integer> snapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(values));
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
