package com.descent.engine.game;

import java.util.List;

/**
 * What one engine call did.
 *
 * @param success whether the action was accepted
 * @param reason  why it was refused, null on success
 * @param message human-readable detail
 * @param events  lifecycle events emitted by this call, in order
 * @param effects per-effect outcomes of the played card or potion
 * @param phase   combat phase after the call
 */
public record ActionResult(
        boolean success,
        IllegalAction reason,
        String message,
        List<CombatEvent> events,
        List<EffectResult> effects,
        CombatPhase phase
) {

    public static ActionResult rejected(IllegalAction reason, String message, CombatPhase phase) {
        return new ActionResult(false, reason, message, List.of(), List.of(), phase);
    }

    public static ActionResult ok(List<CombatEvent> events, List<EffectResult> effects, CombatPhase phase) {
        return new ActionResult(true, null, null, List.copyOf(events), List.copyOf(effects), phase);
    }

    public boolean isCombatOver() {
        return phase.isTerminal();
    }
}
