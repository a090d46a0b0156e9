package com.descent.engine.game;

/**
 * One emitted lifecycle event.
 * <p>The id slots read "source acts on target". Combatants, relics and potions appear by id,
 * cards by display name. Card events (CARD_PLAYED, the typed *_PLAYED events, FIRST_ATTACK_COMBAT,
 * CARD_DRAWN, CARD_DISCARDED, CARD_EXHAUSTED) carry the card name as target; potion events
 * (POTION_USED, POTION_GAINED) carry the potion id as target.
 *
 * @param type     event kind
 * @param turn     turn number when emitted
 * @param sourceId what caused it: combatant id, card name, relic id or potion id; null if nothing did
 * @param targetId what it happened to: combatant id, card name or potion id; null if none
 * @param value    amount involved (damage, block, cards), 0 if none
 */
public record CombatEvent(LifecycleEvent type, int turn, String sourceId, String targetId, int value) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("T").append(turn).append(' ').append(type);
        if (sourceId != null) {
            sb.append(" from ").append(sourceId);
        }
        if (targetId != null) {
            sb.append(" to ").append(targetId);
        }
        if (value != 0) {
            sb.append(" (").append(value).append(')');
        }
        return sb.toString();
    }
}
