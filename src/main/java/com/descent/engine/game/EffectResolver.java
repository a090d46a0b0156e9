package com.descent.engine.game;

import com.descent.engine.card.Card;
import com.descent.engine.card.CardTemplate;
import com.descent.engine.card.CardType;
import com.descent.engine.card.Effect;
import com.descent.engine.card.EffectType;
import com.descent.engine.card.Rarity;
import com.descent.engine.card.TargetType;
import com.descent.engine.catalog.Catalog;
import com.descent.engine.combat.Combatant;
import com.descent.engine.combat.DamageCalculator;
import com.descent.engine.combat.Player;
import com.descent.engine.combat.StatusEffect;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.game.zones.Hand;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Interprets declarative effect lists against a combat.
 * Never throws for bad data or dead targets; every outcome is an {@link EffectResult}.
 */
public class EffectResolver {
    private static final Logger logger = LogManager.getLogger(EffectResolver.class.getName());

    private final Catalog catalog;

    public EffectResolver(Catalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Resolve effects in order, stopping at the first halting result or when the combat ends.
     * X-cost cards resolve each effect once per energy spent; a 0-value effect instead takes the energy as its value.
     */
    public List<EffectResult> resolve(List<Effect> effects, EffectContext ctx) {
        List<EffectResult> results = new ArrayList<>();
        boolean xCost = ctx.sourceCard() != null && ctx.sourceCard().isXCost();

        for (Effect effect : effects) {
            if (ctx.state().isOver()) {
                break;
            }
            Effect scaled = effect;
            if (xCost) {
                if (ctx.energySpent() <= 0) {
                    results.add(EffectResult.skipped("X is 0"));
                    continue;
                }
                scaled = effect.value() == 0
                        ? effect.withValue(ctx.energySpent())
                        : effect.withTimes(effect.times() * ctx.energySpent());
            }

            EffectResult result = resolveEffect(scaled, ctx);
            results.add(result);
            if (!result.shouldContinue()) {
                logger.debug("Effect list from {} halted at {}: {}", ctx.sourceId(), effect.type(), result.message());
                break;
            }
        }
        return results;
    }

    /**
     * One effect, including its repetitions.
     */
    public EffectResult resolveEffect(Effect effect, EffectContext ctx) {
        int total = 0;
        boolean anySuccess = false;
        EffectResult last = EffectResult.skipped("not applied");
        for (int i = 0; i < effect.times(); i++) {
            if (ctx.state().isOver()) {
                break;
            }
            last = resolveOnce(effect, ctx);
            if (last.success()) {
                anySuccess = true;
                total += last.value();
            }
            if (!last.shouldContinue()) {
                return last;
            }
        }
        return anySuccess ? EffectResult.ok(total) : last;
    }

    private EffectResult resolveOnce(Effect effect, EffectContext ctx) {
        return switch (effect.type()) {
            case DAMAGE, DAMAGE_ALL, DAMAGE_RANDOM -> damage(effect, ctx, t -> effect.value());
            case DAMAGE_EQUAL_BLOCK -> damage(effect, ctx, t -> ctx.owner().getBlock());
            case DAMAGE_PER_DISCARD -> damage(effect, ctx,
                    t -> effect.value() * ctx.state().getDiscardPile().size());
            case DAMAGE_EQUAL_POISON -> damage(effect, ctx, t -> t.getStatus(StatusEffect.POISON));
            case BLOCK -> block(effect, ctx);
            case DOUBLE_BLOCK -> {
                Combatant owner = ctx.owner();
                int gained = owner.getBlock();
                owner.gainBlock(gained);
                emitBlockGained(ctx, owner, gained);
                yield EffectResult.ok(gained);
            }
            case DRAW -> playerOnly(ctx, p -> ctx.state().drawCards(effect.value()).size());
            case DISCARD -> playerOnly(ctx, p -> discardRandom(ctx.state(), effect.value()));
            case EXHAUST -> playerOnly(ctx, p -> exhaustRandom(ctx.state(), effect.value()));
            case ADD_TO_HAND, ADD_TO_DISCARD, ADD_TO_DRAW -> addCards(effect, ctx);
            case DUPLICATE_CARD -> duplicateSource(effect, ctx);
            case GAIN_ENERGY -> playerOnly(ctx, p -> {
                p.gainEnergy(effect.value());
                return effect.value();
            });
            case LOSE_ENERGY -> playerOnly(ctx, p -> {
                int before = p.getEnergy();
                p.loseEnergy(effect.value());
                return before - p.getEnergy();
            });
            case HEAL -> forEachTarget(effect, ctx, t -> t.heal(effect.value()));
            case LOSE_HP -> forEachTarget(effect, ctx, t -> loseHp(ctx, t, effect.value()));
            case GAIN_MAX_HP -> forEachTarget(effect, ctx, t -> {
                t.increaseMaxHp(effect.value());
                return effect.value();
            });
            case APPLY_STRENGTH, APPLY_DEXTERITY, APPLY_ARTIFACT, APPLY_PLATED_ARMOR, APPLY_THORNS,
                 APPLY_RITUAL, APPLY_INTANGIBLE, APPLY_REGEN -> forEachTarget(effect, ctx, t -> {
                t.applyStatus(effect.type().getStatusEffect().orElseThrow(), effect.value());
                return effect.value();
            });
            case APPLY_VULNERABLE, APPLY_WEAK, APPLY_FRAIL, APPLY_POISON, REDUCE_STRENGTH ->
                    forEachTarget(effect, ctx, t -> debuff(effect, ctx, t));
            case UPGRADE_CARD -> playerOnly(ctx, p -> upgradeInHand(ctx.state(), effect.value()));
            case TRANSFORM_CARD -> playerOnly(ctx, p -> transformInHand(ctx.state(), Math.max(1, effect.value())));
            case NEXT_CARD_TWICE -> playerOnly(ctx, p -> {
                ctx.state().addDoublePlayCharges(Math.max(1, effect.value()));
                return Math.max(1, effect.value());
            });
            case SCRY -> playerOnly(ctx, p -> scry(ctx.state(), effect.value()));
            case RETAIN_HAND -> playerOnly(ctx, p -> {
                ctx.state().setRetainHandThisTurn(true);
                return ctx.state().getHand().size();
            });
            case RETAIN_ALL_BLOCK -> playerOnly(ctx, p -> {
                p.setRetainBlockThisCombat(true);
                return 1;
            });
            // Applied by the engine while the card sits in hand at end of turn
            case END_TURN_DAMAGE -> EffectResult.ok(0);
        };
    }

    // ---- Targeting ----

    /**
     * Combatants an effect lands on. Enemy-owned effects hit the enemy itself for SELF, else the player.
     */
    public List<Combatant> resolveTargets(Effect effect, EffectContext ctx) {
        TargetType kind = targetKind(effect, ctx);
        if (ctx.fromEnemy()) {
            Combatant self = ctx.source();
            if (kind == TargetType.SELF) {
                return self.isAlive() ? List.of(self) : List.of();
            }
            Player player = ctx.player();
            return player.isAlive() ? List.of(player) : List.of();
        }

        return switch (kind) {
            case SELF -> List.of(ctx.player());
            case SINGLE_ENEMY -> ctx.target() != null && ctx.target().isAlive()
                    ? List.of(ctx.target())
                    : List.of();
            case ALL_ENEMIES -> new ArrayList<>(ctx.state().getLivingEnemies());
            case RANDOM_ENEMY -> {
                List<Enemy> living = ctx.state().getLivingEnemies();
                yield living.isEmpty()
                        ? List.of()
                        : List.of(living.get(ctx.state().getRng().nextInt(living.size())));
            }
        };
    }

    private TargetType targetKind(Effect effect, EffectContext ctx) {
        if (effect.type() == EffectType.DAMAGE_ALL) {
            return TargetType.ALL_ENEMIES;
        }
        if (effect.type() == EffectType.DAMAGE_RANDOM) {
            return TargetType.RANDOM_ENEMY;
        }
        if (effect.target() != null) {
            return effect.target();
        }
        if (effect.type().isOffensive()) {
            TargetType fallback = ctx.defaultTarget();
            return fallback == null ? TargetType.SINGLE_ENEMY : fallback;
        }
        return TargetType.SELF;
    }

    // ---- Damage ----

    /**
     * Deal one hit from attacker to target: outgoing and incoming modifiers, block, thorns, kill and outcome checks.
     * A null attacker deals unmodified damage and takes no thorns.
     * @return HP the target lost
     */
    public int dealDamage(Combatant attacker, Combatant target, int base, CombatState state) {
        if (state.isOver() || target.isDead()) {
            return 0;
        }
        Player player = state.getPlayer();
        int before = target.getCurrentHp();
        DamageCalculator.DamageResult hit = target.takeHit(base, attacker);
        int hpLost = before - target.getCurrentHp();

        if (target == player) {
            if (hpLost > 0) {
                state.emit(LifecycleEvent.PLAYER_DAMAGED, CombatState.idOf(attacker), player.getId(), hpLost);
                state.emit(LifecycleEvent.HP_LOST, CombatState.idOf(attacker), player.getId(), hpLost);
            }
        } else {
            state.emit(LifecycleEvent.DAMAGE_DEALT, CombatState.idOf(attacker), target.getId(), hit.totalDamage());
            if (target.isDead()) {
                state.emit(LifecycleEvent.ENEMY_KILLED, CombatState.idOf(attacker), target.getId(), 0);
            }
        }
        if (state.updateOutcome()) {
            return hpLost;
        }

        int thorns = DamageCalculator.thornsDamage(target.getStatus(StatusEffect.THORNS));
        if (attacker != null && thorns > 0 && attacker.isAlive()) {
            int reflected = attacker.takeRawHit(thorns);
            if (attacker == player && reflected > 0) {
                state.emit(LifecycleEvent.PLAYER_DAMAGED, target.getId(), player.getId(), reflected);
                state.emit(LifecycleEvent.HP_LOST, target.getId(), player.getId(), reflected);
            } else if (attacker != player && attacker.isDead()) {
                state.emit(LifecycleEvent.ENEMY_KILLED, target.getId(), attacker.getId(), 0);
            }
            state.updateOutcome();
        }
        return hpLost;
    }

    private EffectResult damage(Effect effect, EffectContext ctx, DamageBase base) {
        List<Combatant> targets = resolveTargets(effect, ctx);
        if (targets.isEmpty()) {
            return EffectResult.halt("no valid target for " + effect.type());
        }
        int total = 0;
        for (Combatant target : targets) {
            total += dealDamage(ctx.attacker(), target, base.of(target), ctx.state());
        }
        return EffectResult.ok(total);
    }

    @FunctionalInterface
    private interface DamageBase {
        int of(Combatant target);
    }

    private int loseHp(EffectContext ctx, Combatant target, int amount) {
        int lost = target.loseHp(amount);
        CombatState state = ctx.state();
        if (target == state.getPlayer() && lost > 0) {
            state.emit(LifecycleEvent.HP_LOST, ctx.sourceId(), target.getId(), lost);
        } else if (target != state.getPlayer() && target.isDead()) {
            state.emit(LifecycleEvent.ENEMY_KILLED, ctx.sourceId(), target.getId(), 0);
        }
        state.updateOutcome();
        return lost;
    }

    // ---- Block ----

    private EffectResult block(Effect effect, EffectContext ctx) {
        return forEachTarget(effect, ctx, t -> {
            int gained;
            if (ctx.sourceKind().grantsRawBlock()) {
                t.gainBlock(effect.value());
                gained = Math.max(0, effect.value());
            } else {
                gained = t.gainCalculatedBlock(effect.value());
            }
            emitBlockGained(ctx, t, gained);
            return gained;
        });
    }

    private void emitBlockGained(EffectContext ctx, Combatant target, int gained) {
        if (target == ctx.player() && gained > 0) {
            ctx.state().emit(LifecycleEvent.BLOCK_GAINED, ctx.sourceId(), target.getId(), gained);
        }
    }

    // ---- Statuses ----

    private int debuff(Effect effect, EffectContext ctx, Combatant target) {
        CombatState state = ctx.state();
        if (target.tryConsumeArtifact()) {
            if (target == state.getPlayer()) {
                state.emit(LifecycleEvent.DEBUFF_PREVENTED, ctx.sourceId(), target.getId(), effect.value());
            }
            return 0;
        }
        if (effect.type() == EffectType.REDUCE_STRENGTH) {
            int current = target.getStatus(StatusEffect.STRENGTH);
            int reduced = Math.min(current, Math.max(0, current - effect.value()));
            target.getStatus().set(StatusEffect.STRENGTH, reduced);
        } else {
            target.applyStatus(effect.type().getStatusEffect().orElseThrow(), effect.value());
        }
        state.emit(LifecycleEvent.DEBUFF_APPLIED, ctx.sourceId(), target.getId(), effect.value());
        return effect.value();
    }

    // ---- Cards ----

    private EffectResult addCards(Effect effect, EffectContext ctx) {
        if (effect.cardId() == null) {
            logger.warn("{} from {} has no card_id, skipping", effect.type(), ctx.sourceId());
            return EffectResult.skipped("missing card id");
        }
        Optional<CardTemplate> template = catalog.findCard(effect.cardId());
        if (template.isEmpty()) {
            logger.warn("{} from {} references unknown card '{}', skipping",
                    effect.type(), ctx.sourceId(), effect.cardId());
            return EffectResult.skipped("unknown card " + effect.cardId());
        }
        int count = Math.max(1, effect.value());
        CombatState state = ctx.state();
        for (int i = 0; i < count; i++) {
            Card card = catalog.newCard(template.get());
            switch (effect.type()) {
                case ADD_TO_HAND -> state.addToHand(card);
                case ADD_TO_DISCARD -> state.addToDiscard(card);
                default -> state.addToDrawPile(card);
            }
        }
        return EffectResult.ok(count);
    }

    private EffectResult duplicateSource(Effect effect, EffectContext ctx) {
        Card source = ctx.sourceCard();
        if (source == null) {
            return EffectResult.skipped("nothing to duplicate");
        }
        int count = Math.max(1, effect.value());
        for (int i = 0; i < count; i++) {
            Card copy = catalog.newCard(source.getTemplate());
            ctx.state().addToDiscard(source.isUpgraded() ? copy.upgraded() : copy);
        }
        return EffectResult.ok(count);
    }

    private int discardRandom(CombatState state, int count) {
        int discarded = 0;
        for (int i = 0; i < count && !state.getHand().isEmpty(); i++) {
            Hand hand = state.getHand();
            Card card = hand.get(state.getRng().nextInt(hand.size()));
            if (state.discardFromHand(card)) {
                discarded++;
            }
        }
        return discarded;
    }

    private int exhaustRandom(CombatState state, int count) {
        int exhausted = 0;
        for (int i = 0; i < count && !state.getHand().isEmpty(); i++) {
            Hand hand = state.getHand();
            Card card = hand.get(state.getRng().nextInt(hand.size()));
            if (state.exhaustFromHand(card)) {
                exhausted++;
            }
        }
        return exhausted;
    }

    /**
     * Upgrade random upgradable cards in hand; 0 or less upgrades all of them.
     */
    private int upgradeInHand(CombatState state, int count) {
        Hand hand = state.getHand();
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < hand.size(); i++) {
            if (hand.get(i).canUpgrade()) {
                candidates.add(i);
            }
        }
        if (count > 0) {
            state.getRng().shuffle(candidates);
            candidates = candidates.subList(0, Math.min(count, candidates.size()));
        }
        for (int index : candidates) {
            hand.set(index, hand.get(index).upgraded());
        }
        return candidates.size();
    }

    /**
     * Swap random hand cards for random ATTACK/SKILL/POWER catalog cards of a draftable rarity.
     */
    private int transformInHand(CombatState state, int count) {
        List<CardTemplate> pool = catalog.getCards().stream()
                .filter(t -> t.getType() == CardType.ATTACK || t.getType() == CardType.SKILL
                        || t.getType() == CardType.POWER)
                .filter(t -> t.getRarity() != Rarity.STARTER && t.getRarity() != Rarity.SPECIAL)
                .toList();
        if (pool.isEmpty()) {
            logger.warn("No cards available to transform into");
            return 0;
        }
        Hand hand = state.getHand();
        int transformed = 0;
        for (int i = 0; i < count && !hand.isEmpty(); i++) {
            int index = state.getRng().nextInt(hand.size());
            CardTemplate replacement = pool.get(state.getRng().nextInt(pool.size()));
            hand.set(index, catalog.newCard(replacement));
            transformed++;
        }
        return transformed;
    }

    /**
     * Look at the top cards and discard the junk among them (status, curse, unplayable).
     */
    private int scry(CombatState state, int count) {
        int discarded = 0;
        for (Card card : state.getDrawPile().peek(count)) {
            if (card.getType().isJunk() || !card.isPlayable()) {
                state.getDrawPile().remove(card);
                state.addToDiscard(card);
                state.emit(LifecycleEvent.CARD_DISCARDED, null, card.getName(), 1);
                discarded++;
            }
        }
        return discarded;
    }

    // ---- Helpers ----

    @FunctionalInterface
    private interface TargetAction {
        int apply(Combatant target);
    }

    @FunctionalInterface
    private interface PlayerAction {
        int apply(Player player);
    }

    private EffectResult forEachTarget(Effect effect, EffectContext ctx, TargetAction action) {
        List<Combatant> targets = resolveTargets(effect, ctx);
        if (targets.isEmpty()) {
            return EffectResult.halt("no valid target for " + effect.type());
        }
        int total = 0;
        for (Combatant target : targets) {
            total += action.apply(target);
        }
        return EffectResult.ok(total);
    }

    /**
     * Pile, energy and hand effects only make sense for the player's own effects.
     */
    private EffectResult playerOnly(EffectContext ctx, PlayerAction action) {
        if (ctx.fromEnemy()) {
            return EffectResult.skipped("player-only effect used by an enemy");
        }
        return EffectResult.ok(action.apply(ctx.player()));
    }
}
