package com.descent.engine.simulation;

/**
 * Result of a single simulated combat.
 *
 * @param victory     whether every enemy died
 * @param turns       turn on which the combat ended
 * @param hpRemaining player HP at the end
 * @param maxHp       player max HP at the end
 * @param cardsPlayed cards played over the whole combat
 */
public record CombatOutcome(boolean victory, int turns, int hpRemaining, int maxHp, int cardsPlayed) {

    public boolean isWin() {
        return victory;
    }

    /**
     * Share of max HP lost, 0..1.
     */
    public double hpLostFraction() {
        return maxHp == 0 ? 0.0 : (double) (maxHp - hpRemaining) / maxHp;
    }
}
