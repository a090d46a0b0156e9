package com.descent.engine.relic;

import com.descent.engine.game.LifecycleEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps legacy relic trigger spellings onto the canonical event names.
 * Unknown names are logged and returned unchanged.
 */
public final class TriggerNormalizer {
    private static final Logger logger = LogManager.getLogger(TriggerNormalizer.class.getName());

    private static final Map<String, String> MIGRATIONS = new HashMap<>();

    static {
        // camelCase hook names
        MIGRATIONS.put("onCombatStart", "COMBAT_START");
        MIGRATIONS.put("onCombatEnd", "COMBAT_END");
        MIGRATIONS.put("onCombatVictory", "COMBAT_VICTORY");
        MIGRATIONS.put("onTurnStart", "TURN_START");
        MIGRATIONS.put("onTurnEnd", "TURN_END");
        MIGRATIONS.put("onFirstTurn", "FIRST_TURN");
        MIGRATIONS.put("onCardPlayed", "CARD_PLAYED");
        MIGRATIONS.put("onAttackPlayed", "ATTACK_PLAYED");
        MIGRATIONS.put("onSkillPlayed", "SKILL_PLAYED");
        MIGRATIONS.put("onPowerPlayed", "POWER_PLAYED");
        MIGRATIONS.put("onFirstAttack", "FIRST_ATTACK_COMBAT");
        MIGRATIONS.put("onCardDrawn", "CARD_DRAWN");
        MIGRATIONS.put("onCardDiscarded", "CARD_DISCARDED");
        MIGRATIONS.put("onCardExhausted", "CARD_EXHAUSTED");
        MIGRATIONS.put("onShuffle", "SHUFFLE");
        MIGRATIONS.put("onPlayerDamaged", "PLAYER_DAMAGED");
        MIGRATIONS.put("onDamageDealt", "DAMAGE_DEALT");
        MIGRATIONS.put("onEnemyKilled", "ENEMY_KILLED");
        MIGRATIONS.put("onBlockGained", "BLOCK_GAINED");
        MIGRATIONS.put("onDebuffPrevented", "DEBUFF_PREVENTED");
        MIGRATIONS.put("onRestSite", "REST_SITE_ENTER");
        MIGRATIONS.put("onMerchant", "MERCHANT_ENTER");
        MIGRATIONS.put("onEvent", "EVENT_ENTER");
        MIGRATIONS.put("onTreasure", "TREASURE_ENTER");
        MIGRATIONS.put("onRoomEnter", "ROOM_ENTER");
        MIGRATIONS.put("onGoldGained", "GOLD_GAINED");
        MIGRATIONS.put("onGoldSpent", "GOLD_SPENT");
        MIGRATIONS.put("onPotionGained", "POTION_GAINED");
        MIGRATIONS.put("onPotionUsed", "POTION_USED");
        MIGRATIONS.put("onObtain", "ON_OBTAIN");
        MIGRATIONS.put("onRelicObtained", "RELIC_OBTAINED");
        MIGRATIONS.put("onCardObtained", "CARD_OBTAINED");
        MIGRATIONS.put("passive", "PASSIVE");

        // Word-order variants
        MIGRATIONS.put("START_COMBAT", "COMBAT_START");
        MIGRATIONS.put("END_COMBAT", "COMBAT_END");
        MIGRATIONS.put("START_TURN", "TURN_START");
        MIGRATIONS.put("END_TURN", "TURN_END");
        MIGRATIONS.put("CARD_PLAY", "CARD_PLAYED");
        MIGRATIONS.put("ATTACK_PLAY", "ATTACK_PLAYED");
        MIGRATIONS.put("SKILL_PLAY", "SKILL_PLAYED");
        MIGRATIONS.put("POWER_PLAY", "POWER_PLAYED");
    }

    private TriggerNormalizer() {
        // Utility class - prevent instantiation
    }

    /**
     * Canonical name for a trigger, or the input itself when nothing matches.
     */
    public static String normalize(String trigger) {
        if (trigger == null || trigger.isBlank()) {
            logger.warn("Relic effect has no trigger");
            return "";
        }
        String trimmed = trigger.trim();

        String migrated = MIGRATIONS.get(trimmed);
        if (migrated != null) {
            return migrated;
        }
        if (LifecycleEvent.fromName(trimmed).isPresent()) {
            return trimmed;
        }

        String snake = toUpperSnake(trimmed);
        migrated = MIGRATIONS.getOrDefault(snake, snake);
        if (LifecycleEvent.fromName(migrated).isPresent()) {
            return migrated;
        }

        logger.warn("Unknown relic trigger '{}', keeping it as-is", trigger);
        return trimmed;
    }

    /**
     * True when the name is one of the canonical events.
     */
    public static boolean isKnown(String trigger) {
        return LifecycleEvent.fromName(trigger).isPresent();
    }

    static String toUpperSnake(String value) {
        String stripped = value.startsWith("on") && value.length() > 2 && Character.isUpperCase(value.charAt(2))
                ? value.substring(2)
                : value;
        return stripped
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase();
    }
}
