package com.descent.engine.game;

/**
 * States of one combat. VICTORY and DEFEAT are terminal.
 */
public enum CombatPhase {
    NOT_STARTED,
    PLAYER_TURN,
    ENEMY_TURN,
    VICTORY,
    DEFEAT;

    public boolean isTerminal() {
        return this == VICTORY || this == DEFEAT;
    }

    public boolean isActive() {
        return this == PLAYER_TURN || this == ENEMY_TURN;
    }
}
