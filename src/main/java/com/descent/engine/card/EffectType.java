package com.descent.engine.card;

import com.descent.engine.combat.StatusEffect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed vocabulary of effect kinds used by cards, potions and enemy moves.
 */
public enum EffectType {
    // Damage
    DAMAGE(Category.DAMAGE, null),
    DAMAGE_ALL(Category.DAMAGE, null),
    DAMAGE_RANDOM(Category.DAMAGE, null),
    DAMAGE_EQUAL_BLOCK(Category.DAMAGE, null),
    DAMAGE_PER_DISCARD(Category.DAMAGE, null),
    DAMAGE_EQUAL_POISON(Category.DAMAGE, null),

    // Block
    BLOCK(Category.BLOCK, null),
    DOUBLE_BLOCK(Category.BLOCK, null),

    // Card piles
    DRAW(Category.CARD, null),
    DISCARD(Category.CARD, null),
    EXHAUST(Category.CARD, null),
    ADD_TO_HAND(Category.CARD, null),
    ADD_TO_DISCARD(Category.CARD, null),
    ADD_TO_DRAW(Category.CARD, null),
    DUPLICATE_CARD(Category.CARD, null),

    // Energy and HP
    GAIN_ENERGY(Category.RESOURCE, null),
    LOSE_ENERGY(Category.RESOURCE, null),
    HEAL(Category.RESOURCE, null),
    LOSE_HP(Category.RESOURCE, null),
    GAIN_MAX_HP(Category.RESOURCE, null),

    // Buffs
    APPLY_STRENGTH(Category.BUFF, StatusEffect.STRENGTH),
    APPLY_DEXTERITY(Category.BUFF, StatusEffect.DEXTERITY),
    APPLY_ARTIFACT(Category.BUFF, StatusEffect.ARTIFACT),
    APPLY_PLATED_ARMOR(Category.BUFF, StatusEffect.PLATED_ARMOR),
    APPLY_THORNS(Category.BUFF, StatusEffect.THORNS),
    APPLY_RITUAL(Category.BUFF, StatusEffect.RITUAL),
    APPLY_INTANGIBLE(Category.BUFF, StatusEffect.INTANGIBLE),
    APPLY_REGEN(Category.BUFF, StatusEffect.REGEN),

    // Debuffs
    APPLY_VULNERABLE(Category.DEBUFF, StatusEffect.VULNERABLE),
    APPLY_WEAK(Category.DEBUFF, StatusEffect.WEAK),
    APPLY_FRAIL(Category.DEBUFF, StatusEffect.FRAIL),
    APPLY_POISON(Category.DEBUFF, StatusEffect.POISON),
    REDUCE_STRENGTH(Category.DEBUFF, StatusEffect.STRENGTH),

    // Special
    UPGRADE_CARD(Category.SPECIAL, null),
    TRANSFORM_CARD(Category.SPECIAL, null),
    NEXT_CARD_TWICE(Category.SPECIAL, null),
    SCRY(Category.SPECIAL, null),
    RETAIN_HAND(Category.SPECIAL, null),
    RETAIN_ALL_BLOCK(Category.SPECIAL, null),
    END_TURN_DAMAGE(Category.SPECIAL, null);

    /**
     * Display/matching class of an effect.
     */
    public enum Category {
        DAMAGE,
        BLOCK,
        CARD,
        RESOURCE,
        BUFF,
        DEBUFF,
        SPECIAL
    }

    private final Category category;
    private final StatusEffect status;

    EffectType(Category category, StatusEffect status) {
        this.category = category;
        this.status = status;
    }

    @JsonValue
    public String getJsonValue() {
        return name();
    }

    public Category getCategory() {
        return category;
    }

    public boolean isDamage() {
        return category == Category.DAMAGE;
    }

    public boolean isBlock() {
        return category == Category.BLOCK;
    }

    public boolean isBuff() {
        return category == Category.BUFF;
    }

    public boolean isDebuff() {
        return category == Category.DEBUFF;
    }

    /**
     * Effects that hit enemies when played by the player.
     */
    public boolean isOffensive() {
        return isDamage() || isDebuff();
    }

    /**
     * The status this effect applies, for APPLY_* and REDUCE_STRENGTH.
     */
    public Optional<StatusEffect> getStatusEffect() {
        return Optional.ofNullable(status);
    }

    @JsonCreator
    public static EffectType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Effect type cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown effect type: " + value, e);
        }
    }
}
