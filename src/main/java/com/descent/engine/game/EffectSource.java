package com.descent.engine.game;

/**
 * Where an effect list came from.
 */
public enum EffectSource {
    CARD,
    POTION,
    RELIC,
    ENEMY;

    /**
     * Potion and relic block ignores dexterity and frail.
     */
    public boolean grantsRawBlock() {
        return this == POTION || this == RELIC;
    }
}
