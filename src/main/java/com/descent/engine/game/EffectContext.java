package com.descent.engine.game;

import com.descent.engine.card.Card;
import com.descent.engine.card.TargetType;
import com.descent.engine.combat.Combatant;
import com.descent.engine.combat.Player;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.potion.Potion;
import com.descent.engine.relic.Relic;

import java.util.List;

/**
 * Everything an effect list needs to resolve.
 *
 * @param state         combat being mutated
 * @param sourceKind    card, potion, relic or enemy
 * @param source        combatant that owns the effects (player, or the acting enemy)
 * @param target        chosen enemy, may be null
 * @param sourceCard    card being played, may be null
 * @param defaultTarget target kind for offensive effects without their own override
 * @param energySpent   energy paid for the card, used by X-cost scaling
 * @param sourceId      id recorded on emitted events
 */
public record EffectContext(
        CombatState state,
        EffectSource sourceKind,
        Combatant source,
        Enemy target,
        Card sourceCard,
        TargetType defaultTarget,
        int energySpent,
        String sourceId
) {

    public static EffectContext forCard(CombatState state, Card card, Enemy target, int energySpent) {
        return new EffectContext(state, EffectSource.CARD, state.getPlayer(), target, card,
                card.getTargetType(), energySpent, card.getName());
    }

    public static EffectContext forPotion(CombatState state, Potion potion, Enemy target) {
        return new EffectContext(state, EffectSource.POTION, state.getPlayer(), target, null,
                potion.getTargetType(), 0, potion.getId());
    }

    public static EffectContext forRelic(CombatState state, Relic relic) {
        return new EffectContext(state, EffectSource.RELIC, state.getPlayer(), null, null,
                TargetType.ALL_ENEMIES, 0, relic.getId());
    }

    public static EffectContext forEnemy(CombatState state, Enemy enemy) {
        return new EffectContext(state, EffectSource.ENEMY, enemy, null, null,
                TargetType.SINGLE_ENEMY, 0, enemy.getId());
    }

    public Player player() {
        return state.getPlayer();
    }

    public List<Enemy> enemies() {
        return state.getEnemies();
    }

    /**
     * Whose strength and weak modify outgoing damage. Null for potions and relics.
     */
    public Combatant attacker() {
        return switch (sourceKind) {
            case CARD -> state.getPlayer();
            case ENEMY -> source;
            case POTION, RELIC -> null;
        };
    }

    /**
     * The side the effects belong to: the acting enemy, otherwise the player.
     */
    public Combatant owner() {
        return sourceKind == EffectSource.ENEMY ? source : state.getPlayer();
    }

    public boolean fromEnemy() {
        return sourceKind == EffectSource.ENEMY;
    }
}
