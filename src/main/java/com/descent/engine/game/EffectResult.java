package com.descent.engine.game;

/**
 * Outcome of one effect.
 *
 * @param success        whether the effect did anything
 * @param value          amount applied (damage dealt, block gained, cards drawn...)
 * @param shouldContinue false halts the rest of the effect list
 * @param message        reason for a failure, null on success
 */
public record EffectResult(boolean success, int value, boolean shouldContinue, String message) {

    public static EffectResult ok(int value) {
        return new EffectResult(true, value, true, null);
    }

    /**
     * Nothing happened but the list goes on.
     */
    public static EffectResult skipped(String message) {
        return new EffectResult(false, 0, true, message);
    }

    /**
     * Nothing happened and the remaining effects are dropped.
     */
    public static EffectResult halt(String message) {
        return new EffectResult(false, 0, false, message);
    }
}
