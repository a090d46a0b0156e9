package com.descent.engine.game;

import java.util.Optional;

/**
 * Fixed vocabulary of lifecycle events. Relic triggers name one of these.
 */
public enum LifecycleEvent {
    // Combat
    COMBAT_START,
    COMBAT_END,
    COMBAT_VICTORY,

    // Turns
    TURN_START,
    TURN_END,
    FIRST_TURN,
    EMPTY_HAND_END_TURN,

    // Cards
    CARD_PLAYED,
    ATTACK_PLAYED,
    SKILL_PLAYED,
    POWER_PLAYED,
    FIRST_ATTACK_COMBAT,
    CARD_DRAWN,
    CARD_DISCARDED,
    CARD_EXHAUSTED,
    SHUFFLE,

    // Damage and defense
    PLAYER_DAMAGED,
    DAMAGE_DEALT,
    ENEMY_KILLED,
    BLOCK_GAINED,
    DEBUFF_APPLIED,
    DEBUFF_PREVENTED,
    HP_LOST,

    // Resources
    GOLD_GAINED,
    GOLD_SPENT,
    POTION_GAINED,
    POTION_USED,

    // Rooms
    ROOM_ENTER,
    REST_SITE_ENTER,
    MERCHANT_ENTER,
    EVENT_ENTER,
    TREASURE_ENTER,

    // Meta
    ON_OBTAIN,
    RELIC_OBTAINED,
    CARD_OBTAINED,
    PASSIVE;

    /**
     * Events that only make sense while a combat is running.
     */
    public boolean isCombatEvent() {
        return switch (this) {
            case ROOM_ENTER, REST_SITE_ENTER, MERCHANT_ENTER, EVENT_ENTER, TREASURE_ENTER,
                 ON_OBTAIN, RELIC_OBTAINED, CARD_OBTAINED, GOLD_GAINED, GOLD_SPENT,
                 POTION_GAINED, PASSIVE -> false;
            default -> true;
        };
    }

    public boolean isRoomEvent() {
        return switch (this) {
            case ROOM_ENTER, REST_SITE_ENTER, MERCHANT_ENTER, EVENT_ENTER, TREASURE_ENTER -> true;
            default -> false;
        };
    }

    /**
     * Look up a canonical upper-snake name.
     */
    public static Optional<LifecycleEvent> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (LifecycleEvent event : values()) {
            if (event.name().equals(name)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }
}
