package com.descent.engine.game;

import com.descent.engine.card.Card;
import com.descent.engine.card.Effect;
import com.descent.engine.card.EffectType;
import com.descent.engine.catalog.Catalog;
import com.descent.engine.combat.CombatConstants;
import com.descent.engine.combat.Combatant;
import com.descent.engine.combat.Player;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.potion.Potion;
import com.descent.engine.relic.CounterReset;
import com.descent.engine.relic.Relic;
import com.descent.engine.relic.RelicProcessor;
import com.descent.engine.rng.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Combat state machine: NOT_STARTED, then PLAYER_TURN and ENEMY_TURN alternating, ending in VICTORY or DEFEAT.
 * Every call runs to completion on the calling thread; refused actions change nothing.
 */
public class CombatEngine {
    private static final Logger logger = LogManager.getLogger(CombatEngine.class.getName());

    /** Relic reactions per action before we assume a trigger loop. */
    static final int MAX_EVENTS_PER_ACTION = 10_000;

    private final CombatState state;
    private final EffectResolver resolver;
    private final RelicProcessor relics;
    private boolean endEventsEmitted;

    public CombatEngine(Catalog catalog, RandomSource rng, Player player) {
        this.state = new CombatState(player, rng);
        this.resolver = new EffectResolver(catalog);
        this.relics = new RelicProcessor(resolver);
    }

    // ---- Accessors ----
    public CombatState getState() {
        return state;
    }

    public Player getPlayer() {
        return state.getPlayer();
    }

    public List<Enemy> getEnemies() {
        return state.getEnemies();
    }

    public CombatPhase getPhase() {
        return state.getPhase();
    }

    public boolean isOver() {
        return state.isOver();
    }

    public List<CombatEvent> getEventLog() {
        return state.getEvents().getEvents();
    }

    public EffectResolver getResolver() {
        return resolver;
    }

    /**
     * Give the player a relic and run its ON_OBTAIN effects.
     * @return false if the relic was already held
     */
    public boolean obtainRelic(Relic relic) {
        return relics.obtainRelic(state.getPlayer(), relic);
    }

    /**
     * Put a potion in the first free slot and fire POTION_GAINED.
     * @return false when every slot is full
     */
    public boolean gainPotion(Potion potion) {
        if (!state.getPlayer().addPotion(potion)) {
            return false;
        }
        fireResourceEvent(LifecycleEvent.POTION_GAINED, potion.getId(), 1);
        return true;
    }

    /**
     * Pay gold and fire GOLD_SPENT.
     * @return false when the player cannot afford it
     */
    public boolean spendGold(int amount) {
        if (!state.getPlayer().spendGold(amount)) {
            return false;
        }
        fireResourceEvent(LifecycleEvent.GOLD_SPENT, null, amount);
        return true;
    }

    /**
     * During a combat the event goes through the log and the relic pass; outside one, straight to the relics.
     */
    private void fireResourceEvent(LifecycleEvent type, String targetId, int value) {
        if (!state.getPhase().isActive()) {
            relics.fireOutOfCombat(state.getPlayer(), type);
            return;
        }
        state.emit(type, state.getPlayer().getId(), targetId, value);
        processEvents();
        finishIfOver();
    }

    // ==================== START ====================

    /**
     * Set up piles, draw the opening hand, fire COMBAT_START and roll opening intents.
     */
    public ActionResult startCombat(List<Enemy> enemies) {
        if (state.getPhase() != CombatPhase.NOT_STARTED) {
            return ActionResult.rejected(IllegalAction.ALREADY_STARTED, "Combat already started", state.getPhase());
        }
        if (enemies == null || enemies.isEmpty()) {
            throw new IllegalArgumentException("A combat needs at least one enemy");
        }
        int mark = state.getEvents().size();
        Player player = state.getPlayer();

        state.setEnemies(enemies);
        player.startCombat();
        relics.resetCounters(player, CounterReset.COMBAT);

        List<Card> innate = new ArrayList<>();
        List<Card> rest = new ArrayList<>();
        for (Card card : player.getDeck()) {
            (card.isInnate() ? innate : rest).add(card);
        }
        state.setUpPiles(innate, rest);
        state.setTurn(1);
        state.setPhase(CombatPhase.PLAYER_TURN);

        int openingDraw = Math.min(CombatConstants.MAX_HAND_SIZE, Math.max(player.getHandSize(), innate.size()));
        state.drawCards(openingDraw);

        player.resetEnergy();
        player.gainEnergy(player.consumeBonusEnergy());

        logger.debug("Combat started: {} vs {}", player.getName(), enemies);
        state.emit(LifecycleEvent.COMBAT_START);
        state.emit(LifecycleEvent.TURN_START, null, null, 1);
        state.emit(LifecycleEvent.FIRST_TURN);
        processEvents();

        for (Enemy enemy : state.getLivingEnemies()) {
            enemy.rollMove(state.getRng());
        }
        finishIfOver();
        return complete(mark, List.of());
    }

    // ==================== PLAY CARD ====================

    public ActionResult playCard(int handIndex) {
        return playCard(handIndex, -1);
    }

    /**
     * Play the card at handIndex, aimed at the enemy at targetIndex (-1 for none).
     */
    public ActionResult playCard(int handIndex, int targetIndex) {
        ActionResult refusal = validatePlay(handIndex, targetIndex);
        if (refusal != null) {
            return refusal;
        }
        int mark = state.getEvents().size();
        Player player = state.getPlayer();
        Card card = state.getHand().get(handIndex);
        Enemy target = state.getLivingEnemy(targetIndex);

        int energySpent = card.isXCost() ? player.getEnergy() : card.getCost();
        if (!player.spendEnergy(energySpent)) {
            throw new IllegalStateException("Energy check passed but spend failed for " + card);
        }
        state.getHand().remove(handIndex);

        boolean firstAttack = state.recordCardPlayed(card);
        boolean playTwice = state.consumeDoublePlay();

        EffectContext ctx = EffectContext.forCard(state, card, target, energySpent);
        List<EffectResult> results = new ArrayList<>(resolver.resolve(card.getEffects(), ctx));
        if (playTwice && !state.isOver()) {
            results.addAll(resolver.resolve(card.getEffects(), ctx));
        }

        state.emit(LifecycleEvent.CARD_PLAYED, player.getId(), card.getName(), energySpent);
        LifecycleEvent typed = switch (card.getType()) {
            case ATTACK -> LifecycleEvent.ATTACK_PLAYED;
            case SKILL -> LifecycleEvent.SKILL_PLAYED;
            case POWER -> LifecycleEvent.POWER_PLAYED;
            case STATUS, CURSE -> null;
        };
        if (typed != null) {
            state.emit(typed, player.getId(), card.getName(), energySpent);
        }
        if (firstAttack) {
            state.emit(LifecycleEvent.FIRST_ATTACK_COMBAT, player.getId(), card.getName(), 0);
        }

        if (card.isExhaust()) {
            state.exhaust(card);
        } else {
            state.addToDiscard(card);
        }

        processEvents();
        finishIfOver();
        return complete(mark, results);
    }

    /**
     * Refusal for an illegal play, or null if the play is legal.
     */
    public ActionResult validatePlay(int handIndex, int targetIndex) {
        ActionResult turnCheck = requirePlayerTurn();
        if (turnCheck != null) {
            return turnCheck;
        }
        Card card = state.getHand().get(handIndex);
        if (card == null) {
            return reject(IllegalAction.INVALID_HAND_INDEX, "No card at hand index " + handIndex);
        }
        if (!card.isPlayable()) {
            return reject(IllegalAction.UNPLAYABLE_CARD, card.getName() + " cannot be played");
        }
        if (!card.isXCost() && card.getCost() > state.getPlayer().getEnergy()) {
            return reject(IllegalAction.INSUFFICIENT_ENERGY, card.getName() + " costs " + card.getCost()
                    + ", have " + state.getPlayer().getEnergy());
        }
        if (card.getTargetType().requiresTarget() && state.getLivingEnemy(targetIndex) == null) {
            return reject(IllegalAction.INVALID_TARGET, card.getName() + " needs a living enemy target");
        }
        return null;
    }

    // ==================== POTIONS ====================

    public ActionResult usePotion(int slot) {
        return usePotion(slot, -1);
    }

    /**
     * Drink the potion in a slot, aimed at the enemy at targetIndex (-1 for none).
     */
    public ActionResult usePotion(int slot, int targetIndex) {
        ActionResult turnCheck = requirePlayerTurn();
        if (turnCheck != null) {
            return turnCheck;
        }
        Player player = state.getPlayer();
        Potion potion = player.getPotion(slot).orElse(null);
        if (potion == null) {
            return reject(IllegalAction.INVALID_POTION_SLOT, "No potion in slot " + slot);
        }
        if (potion.requiresTarget() && state.getLivingEnemy(targetIndex) == null) {
            return reject(IllegalAction.INVALID_TARGET, potion.getName() + " needs a living enemy target");
        }
        int mark = state.getEvents().size();

        player.removePotion(slot);
        EffectContext ctx = EffectContext.forPotion(state, potion, state.getLivingEnemy(targetIndex));
        List<EffectResult> results = resolver.resolve(potion.getEffects(), ctx);
        state.emit(LifecycleEvent.POTION_USED, player.getId(), potion.getId(), 0);

        processEvents();
        finishIfOver();
        return complete(mark, results);
    }

    // ==================== END TURN ====================

    /**
     * End the player's turn, run every enemy's turn, and start the next player turn.
     */
    public ActionResult endTurn() {
        ActionResult turnCheck = requirePlayerTurn();
        if (turnCheck != null) {
            return turnCheck;
        }
        int mark = state.getEvents().size();
        Player player = state.getPlayer();

        if (state.getHand().isEmpty()) {
            state.emit(LifecycleEvent.EMPTY_HAND_END_TURN);
        }
        player.tickEndOfTurn();
        applyEndOfTurnCardDamage();
        if (!state.updateOutcome()) {
            state.emit(LifecycleEvent.TURN_END, null, null, state.getTurn());
            processEvents();
        }
        if (!state.updateOutcome()) {
            discardHandAtEndOfTurn();
            processEvents();
        }

        if (!state.updateOutcome()) {
            state.setPhase(CombatPhase.ENEMY_TURN);
            runEnemyTurn();
        }
        if (!state.updateOutcome()) {
            startPlayerTurn();
        }

        finishIfOver();
        return complete(mark, List.of());
    }

    private void applyEndOfTurnCardDamage() {
        Player player = state.getPlayer();
        for (Card card : state.getHand().getCards()) {
            for (Effect effect : card.getEffects()) {
                if (effect.type() == EffectType.END_TURN_DAMAGE && effect.value() > 0) {
                    int lost = player.loseHp(effect.value());
                    if (lost > 0) {
                        state.emit(LifecycleEvent.HP_LOST, card.getName(), player.getId(), lost);
                    }
                }
            }
        }
    }

    /**
     * Retained cards stay, ethereal cards exhaust, everything else is discarded.
     */
    private void discardHandAtEndOfTurn() {
        boolean retainAll = state.isRetainHandThisTurn();
        for (Card card : state.getHand().getCards()) {
            if (card.isEthereal()) {
                state.exhaustFromHand(card);
            } else if (!retainAll && !card.isRetain()) {
                state.discardFromHand(card);
            }
        }
    }

    private void runEnemyTurn() {
        for (Enemy enemy : state.getEnemies()) {
            if (enemy.isDead()) {
                continue;
            }
            Combatant.TurnStartTick tick = enemy.tickStartOfTurn();
            if (tick.poisonDamage() > 0 && enemy.isDead()) {
                state.emit(LifecycleEvent.ENEMY_KILLED, null, enemy.getId(), 0);
            }
            if (state.updateOutcome()) {
                return;
            }
            if (enemy.isDead()) {
                continue;
            }

            List<Effect> actions = enemy.executeMove(state.getRng());
            logger.debug("{} acts: {}", enemy.getName(), actions);
            resolver.resolve(actions, EffectContext.forEnemy(state, enemy));
            processEvents();
            if (state.updateOutcome()) {
                return;
            }
            enemy.tickEndOfTurn();
        }
    }

    private void startPlayerTurn() {
        Player player = state.getPlayer();
        state.setTurn(state.getTurn() + 1);
        state.setPhase(CombatPhase.PLAYER_TURN);
        state.resetTurnCounters();
        relics.resetCounters(player, CounterReset.TURN);

        Combatant.TurnStartTick tick = player.tickStartOfTurn();
        if (tick.poisonDamage() > 0) {
            state.emit(LifecycleEvent.HP_LOST, null, player.getId(), tick.poisonDamage());
        }
        if (state.updateOutcome()) {
            return;
        }

        player.resetEnergy();
        state.drawCards(player.getHandSize());
        state.emit(LifecycleEvent.TURN_START, null, null, state.getTurn());
        processEvents();
        logger.debug("Turn {} begins: {}", state.getTurn(), player);
    }

    // ==================== BOOKKEEPING ====================

    /**
     * Feed every pending event to the relic pass, including events the relics themselves emit.
     */
    private void processEvents() {
        int processed = 0;
        EventLog log = state.getEvents();
        while (log.hasPending()) {
            if (++processed > MAX_EVENTS_PER_ACTION) {
                throw new IllegalStateException("Relic triggers did not settle after " + MAX_EVENTS_PER_ACTION + " events");
            }
            relics.onEvent(log.pollPending(), state);
        }
    }

    /**
     * Emit the end-of-combat events once the outcome is decided.
     */
    private void finishIfOver() {
        if (!state.updateOutcome() || endEventsEmitted) {
            return;
        }
        endEventsEmitted = true;
        if (state.getPhase() == CombatPhase.VICTORY) {
            state.emit(LifecycleEvent.COMBAT_VICTORY);
        }
        state.emit(LifecycleEvent.COMBAT_END);
        processEvents();
        logger.debug("Combat ended in {} on turn {} ({} hp left)",
                state.getPhase(), state.getTurn(), state.getPlayer().getCurrentHp());
    }

    private ActionResult requirePlayerTurn() {
        if (!state.getPhase().isActive()) {
            return reject(IllegalAction.COMBAT_NOT_ACTIVE, "Combat is " + state.getPhase());
        }
        if (!state.isPlayerTurn()) {
            return reject(IllegalAction.NOT_PLAYER_TURN, "It is not the player's turn");
        }
        return null;
    }

    private ActionResult reject(IllegalAction reason, String message) {
        logger.debug("Rejected: {} ({})", reason, message);
        return ActionResult.rejected(reason, message, state.getPhase());
    }

    private ActionResult complete(int mark, List<EffectResult> results) {
        state.checkPileInvariant();
        return ActionResult.ok(state.getEvents().eventsSince(mark), results, state.getPhase());
    }
}
