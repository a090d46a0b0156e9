package com.descent.engine.game;

/**
 * Why a player action was refused.
 */
public enum IllegalAction {
    ALREADY_STARTED,
    COMBAT_NOT_ACTIVE,
    NOT_PLAYER_TURN,
    INVALID_HAND_INDEX,
    UNPLAYABLE_CARD,
    INSUFFICIENT_ENERGY,
    INVALID_TARGET,
    INVALID_POTION_SLOT
}
