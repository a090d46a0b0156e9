package com.descent.engine.relic;

import com.descent.engine.card.Effect;
import com.descent.engine.card.EffectType;
import com.descent.engine.card.TargetType;
import com.descent.engine.combat.CombatConstants;
import com.descent.engine.combat.Player;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.game.CombatEvent;
import com.descent.engine.game.CombatState;
import com.descent.engine.game.EffectContext;
import com.descent.engine.game.EffectResolver;
import com.descent.engine.game.LifecycleEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Reacts to lifecycle events by running the matching effects of every held relic.
 */
public class RelicProcessor {
    private static final Logger logger = LogManager.getLogger(RelicProcessor.class.getName());

    private final EffectResolver resolver;

    public RelicProcessor(EffectResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Run every relic effect triggered by an in-combat event.
     */
    public void onEvent(CombatEvent event, CombatState state) {
        for (Relic relic : state.getPlayer().getRelics()) {
            for (RelicEffect effect : relic.getEffectsForTrigger(event.type())) {
                execute(relic, effect, state);
            }
        }
    }

    /**
     * Fire a trigger outside combat (room entry, obtaining a relic, gold and potions).
     * Actions that need a combat are skipped.
     * @throws IllegalArgumentException for an event that only happens inside a combat
     */
    public void fireOutOfCombat(Player player, LifecycleEvent event) {
        if (event.isCombatEvent()) {
            throw new IllegalArgumentException(event + " can only fire during a combat");
        }
        for (Relic relic : player.getRelics()) {
            fireOutOfCombat(player, relic, event);
        }
    }

    /**
     * Fire ROOM_ENTER, then the trigger of the room itself.
     * @throws IllegalArgumentException if the event is not a room entry
     */
    public void enterRoom(Player player, LifecycleEvent room) {
        if (!room.isRoomEvent()) {
            throw new IllegalArgumentException(room + " is not a room entry");
        }
        fireOutOfCombat(player, LifecycleEvent.ROOM_ENTER);
        if (room != LifecycleEvent.ROOM_ENTER) {
            fireOutOfCombat(player, room);
        }
    }

    /**
     * Give the player a relic and run its ON_OBTAIN effects.
     * @return false if the relic was already held
     */
    public boolean obtainRelic(Player player, Relic relic) {
        if (!player.addRelic(relic)) {
            return false;
        }
        fireOutOfCombat(player, relic, LifecycleEvent.ON_OBTAIN);
        return true;
    }

    /**
     * Zero the counters of relics whose reset policy matches the boundary.
     */
    public void resetCounters(Player player, CounterReset boundary) {
        for (Relic relic : player.getRelics()) {
            if (relic.getTemplate().getCounterReset() == boundary) {
                relic.resetCounter();
            }
        }
    }

    private void fireOutOfCombat(Player player, Relic relic, LifecycleEvent event) {
        for (RelicEffect effect : relic.getEffectsForTrigger(event)) {
            RelicAction action = effect.actionKind().orElse(null);
            if (action == null) {
                logger.warn("Relic {} has unknown action '{}', skipping", relic.getId(), effect.getAction());
                continue;
            }
            if (action.requiresCombat()) {
                logger.debug("Relic {} action {} needs a combat, skipped on {}", relic.getId(), action, event);
                continue;
            }
            applyToPlayer(player, action, effect.getValue());
        }
    }

    private void execute(Relic relic, RelicEffect effect, CombatState state) {
        RelicAction action = effect.actionKind().orElse(null);
        if (action == null) {
            logger.warn("Relic {} has unknown action '{}', skipping", relic.getId(), effect.getAction());
            return;
        }
        if (state.isOver() && action.requiresCombat()) {
            return;
        }

        switch (action.getKind()) {
            case DIRECT -> applyDirect(relic, action, effect.getValue(), state);
            case COUNTER -> {
                int every = Math.max(1, effect.getValue());
                if (relic.incrementCounter() >= every) {
                    relic.resetCounter();
                    applyCounter(relic, action, effect.getPayload(), state);
                }
            }
            case PASSIVE -> {
                if (action == RelicAction.ENERGY_NEXT_COMBAT) {
                    state.getPlayer().addBonusEnergyNextCombat(effect.getValue());
                }
            }
        }
    }

    private void applyDirect(Relic relic, RelicAction action, int value, CombatState state) {
        Player player = state.getPlayer();
        EffectContext ctx = EffectContext.forRelic(state, relic);
        switch (action) {
            case HEAL, HEAL_PERCENT, GAIN_MAX_HP, GAIN_GOLD -> {
                if (action == RelicAction.GAIN_GOLD && value > 0) {
                    state.emit(LifecycleEvent.GOLD_GAINED, relic.getId(), player.getId(), value);
                }
                applyToPlayer(player, action, value);
            }
            case BLOCK -> resolver.resolveEffect(Effect.of(EffectType.BLOCK, value, TargetType.SELF), ctx);
            case DRAW -> state.drawCards(value);
            case GAIN_ENERGY -> player.gainEnergy(value);
            case GAIN_STRENGTH -> resolver.resolveEffect(Effect.of(EffectType.APPLY_STRENGTH, value, TargetType.SELF), ctx);
            case GAIN_DEXTERITY -> resolver.resolveEffect(Effect.of(EffectType.APPLY_DEXTERITY, value, TargetType.SELF), ctx);
            case THORNS, DAMAGE_RANDOM -> damageRandom(value, state);
            case DAMAGE_ALL -> resolver.resolveEffect(Effect.of(EffectType.DAMAGE_ALL, value), ctx);
            case APPLY_VULNERABLE -> resolver.resolveEffect(
                    Effect.of(EffectType.APPLY_VULNERABLE, value, TargetType.ALL_ENEMIES), ctx);
            case APPLY_WEAK -> resolver.resolveEffect(
                    Effect.of(EffectType.APPLY_WEAK, value, TargetType.ALL_ENEMIES), ctx);
            case PLATED_ARMOR -> {
                if (player.getBlock() == 0) {
                    resolver.resolveEffect(Effect.of(EffectType.BLOCK, value, TargetType.SELF), ctx);
                }
            }
            default -> logger.warn("Relic {} action {} is not a direct action", relic.getId(), action);
        }
    }

    private void applyCounter(Relic relic, RelicAction action, int payload, CombatState state) {
        logger.debug("Relic {} counter fired: {} x{}", relic.getId(), action, payload);
        EffectContext ctx = EffectContext.forRelic(state, relic);
        switch (action) {
            case DRAW_EVERY_N -> state.drawCards(payload);
            case ENERGY_EVERY_N -> state.getPlayer().gainEnergy(payload);
            case STRENGTH_EVERY_N -> resolver.resolveEffect(Effect.of(EffectType.APPLY_STRENGTH, payload, TargetType.SELF), ctx);
            case DEXTERITY_EVERY_N -> resolver.resolveEffect(Effect.of(EffectType.APPLY_DEXTERITY, payload, TargetType.SELF), ctx);
            case BLOCK_EVERY_N -> resolver.resolveEffect(Effect.of(EffectType.BLOCK, payload, TargetType.SELF), ctx);
            case DAMAGE_ALL_EVERY_N -> resolver.resolveEffect(Effect.of(EffectType.DAMAGE_ALL, payload), ctx);
            default -> logger.warn("Relic {} action {} is not a counter action", relic.getId(), action);
        }
    }

    private void damageRandom(int amount, CombatState state) {
        List<Enemy> living = state.getLivingEnemies();
        if (living.isEmpty()) {
            return;
        }
        Enemy target = living.get(state.getRng().nextInt(living.size()));
        resolver.dealDamage(null, target, amount, state);
    }

    private static void applyToPlayer(Player player, RelicAction action, int value) {
        switch (action) {
            case HEAL -> player.heal(value);
            case HEAL_PERCENT -> {
                if (player.getCurrentHp() < player.getMaxHp() * CombatConstants.LOW_HP_THRESHOLD) {
                    player.heal(value);
                }
            }
            case GAIN_MAX_HP -> player.increaseMaxHp(value);
            case GAIN_GOLD -> player.gainGold(value);
            case ENERGY_NEXT_COMBAT -> player.addBonusEnergyNextCombat(value);
            default -> logger.debug("Relic action {} has no out-of-combat effect", action);
        }
    }
}
