package com.descent.engine.combat;

/**
 * Combat tunables.
 */
public final class CombatConstants {

    private CombatConstants() {
        // Utility class - prevent instantiation
    }

    public static final double WEAK_MULTIPLIER = 0.75;
    public static final double VULNERABLE_MULTIPLIER = 1.5;
    public static final double FRAIL_MULTIPLIER = 0.75;

    /** Damage taken per hit while intangible. */
    public static final int INTANGIBLE_DAMAGE = 1;

    public static final int HAND_SIZE = 5;
    public static final int MAX_HAND_SIZE = 10;
    public static final int BASE_ENERGY = 3;
    public static final int MAX_ENERGY = 10;

    public static final int PLAYER_MAX_HP = 80;
    public static final int STARTING_GOLD = 99;
    public static final int POTION_SLOTS = 3;

    /** Enemy max HP is rolled within +/- this fraction of the template value. */
    public static final double ENEMY_HP_VARIANCE = 0.10;
    public static final int MOVE_HISTORY_SIZE = 3;

    /** HEAL_PERCENT relics fire only below this share of max HP. */
    public static final double LOW_HP_THRESHOLD = 0.5;
}
