package com.descent.engine.game;

import com.descent.engine.card.Card;
import com.descent.engine.card.CardType;
import com.descent.engine.combat.Combatant;
import com.descent.engine.combat.Player;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.game.zones.DiscardPile;
import com.descent.engine.game.zones.DrawPile;
import com.descent.engine.game.zones.ExhaustPile;
import com.descent.engine.game.zones.Hand;
import com.descent.engine.rng.RandomSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Complete state of one combat: piles, turn, phase, roster and per-turn counters.
 */
public class CombatState {
    // Zones
    private final DrawPile drawPile = new DrawPile();
    private final Hand hand = new Hand();
    private final DiscardPile discardPile = new DiscardPile();
    private final ExhaustPile exhaustPile = new ExhaustPile();

    // Combat info
    private final Player player;
    private final List<Enemy> enemies = new ArrayList<>();
    private int turn;
    private CombatPhase phase = CombatPhase.NOT_STARTED;
    private int shuffleCount;

    // Per-turn tracking
    private int cardsPlayedThisTurn;
    private int attacksPlayedThisTurn;
    private int skillsPlayedThisTurn;
    private int cardsPlayedThisCombat;
    private boolean firstAttackPlayed;
    private int doublePlayCharges;
    private boolean retainHandThisTurn;

    private final EventLog events = new EventLog();
    private final RandomSource rng;

    public CombatState(Player player, RandomSource rng) {
        this.player = player;
        this.rng = rng;
    }

    // ---- Zone accessors ----
    public DrawPile getDrawPile() {
        return drawPile;
    }

    public Hand getHand() {
        return hand;
    }

    public DiscardPile getDiscardPile() {
        return discardPile;
    }

    public ExhaustPile getExhaustPile() {
        return exhaustPile;
    }

    // ---- Roster ----
    public Player getPlayer() {
        return player;
    }

    public List<Enemy> getEnemies() {
        return List.copyOf(enemies);
    }

    void setEnemies(List<Enemy> roster) {
        enemies.clear();
        enemies.addAll(roster);
    }

    public List<Enemy> getLivingEnemies() {
        return enemies.stream().filter(Enemy::isAlive).toList();
    }

    /**
     * Enemy at an index if it exists and is alive, else null.
     */
    public Enemy getLivingEnemy(int index) {
        if (index < 0 || index >= enemies.size()) {
            return null;
        }
        Enemy enemy = enemies.get(index);
        return enemy.isAlive() ? enemy : null;
    }

    public boolean allEnemiesDead() {
        return enemies.stream().allMatch(Enemy::isDead);
    }

    // ---- Turn and phase ----
    public int getTurn() {
        return turn;
    }

    void setTurn(int turn) {
        this.turn = turn;
    }

    public CombatPhase getPhase() {
        return phase;
    }

    void setPhase(CombatPhase phase) {
        this.phase = phase;
    }

    public boolean isPlayerTurn() {
        return phase == CombatPhase.PLAYER_TURN;
    }

    public boolean isOver() {
        return phase.isTerminal();
    }

    /**
     * Move to VICTORY or DEFEAT the moment either side is wiped out.
     * Player death is checked first.
     * @return true if the combat is over
     */
    public boolean updateOutcome() {
        if (phase.isTerminal() || phase == CombatPhase.NOT_STARTED) {
            return phase.isTerminal();
        }
        if (player.isDead()) {
            phase = CombatPhase.DEFEAT;
        } else if (allEnemiesDead()) {
            phase = CombatPhase.VICTORY;
        }
        return phase.isTerminal();
    }

    // ---- Events and randomness ----
    public EventLog getEvents() {
        return events;
    }

    public void emit(LifecycleEvent type, String sourceId, String targetId, int value) {
        events.emit(new CombatEvent(type, turn, sourceId, targetId, value));
    }

    public void emit(LifecycleEvent type) {
        emit(type, null, null, 0);
    }

    public RandomSource getRng() {
        return rng;
    }

    // ---- Pile operations ----

    /**
     * Draw up to n cards. An empty draw pile pulls the discard pile in first.
     * Stops early when the hand is full or both piles are empty.
     * @return cards drawn
     */
    public List<Card> drawCards(int n) {
        List<Card> drawn = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (hand.isFull()) {
                break;
            }
            if (drawPile.isEmpty()) {
                if (discardPile.isEmpty()) {
                    break;
                }
                shuffleDiscardIntoDraw();
            }
            Card card = drawPile.draw();
            hand.add(card);
            drawn.add(card);
            emit(LifecycleEvent.CARD_DRAWN, null, card.getName(), 1);
        }
        return drawn;
    }

    public void shuffleDiscardIntoDraw() {
        drawPile.addAll(discardPile.takeAll());
        drawPile.shuffle(rng);
        shuffleCount++;
        emit(LifecycleEvent.SHUFFLE, null, null, drawPile.size());
    }

    public boolean discardFromHand(Card card) {
        if (!hand.remove(card)) {
            return false;
        }
        discardPile.add(card);
        emit(LifecycleEvent.CARD_DISCARDED, null, card.getName(), 1);
        return true;
    }

    public boolean exhaustFromHand(Card card) {
        if (!hand.remove(card)) {
            return false;
        }
        exhaust(card);
        return true;
    }

    /**
     * Put a card that is in no pile into the exhaust pile.
     */
    public void exhaust(Card card) {
        exhaustPile.add(card);
        emit(LifecycleEvent.CARD_EXHAUSTED, null, card.getName(), 1);
    }

    /**
     * Add a generated card to the hand, or to the discard pile if the hand is full.
     */
    public void addToHand(Card card) {
        if (hand.isFull()) {
            discardPile.add(card);
        } else {
            hand.add(card);
        }
    }

    public void addToDiscard(Card card) {
        discardPile.add(card);
    }

    /**
     * Shuffle a generated card into a random spot of the draw pile.
     */
    public void addToDrawPile(Card card) {
        drawPile.insertRandom(card, rng);
    }

    void setUpPiles(List<Card> innate, List<Card> rest) {
        drawPile.clear();
        hand.clear();
        discardPile.clear();
        exhaustPile.clear();
        drawPile.addAll(rest);
        drawPile.shuffle(rng);
        for (int i = innate.size() - 1; i >= 0; i--) {
            drawPile.putOnTop(innate.get(i));
        }
    }

    public int getShuffleCount() {
        return shuffleCount;
    }

    /**
     * Every card of this combat's deck, across all four piles.
     */
    public List<Card> getCombatDeck() {
        List<Card> all = new ArrayList<>(drawPile.getCards());
        all.addAll(hand.getCards());
        all.addAll(discardPile.getCards());
        all.addAll(exhaustPile.getCards());
        return all;
    }

    /**
     * A card must sit in exactly one pile.
     * @throws IllegalStateException on a duplicate
     */
    public void checkPileInvariant() {
        Set<Card> seen = new HashSet<>();
        for (Card card : getCombatDeck()) {
            if (!seen.add(card)) {
                throw new IllegalStateException("Card " + card + " is in more than one pile");
            }
        }
    }

    // ---- Per-turn tracking ----

    /**
     * Count a played card.
     * @return true if it was the first attack of the combat
     */
    boolean recordCardPlayed(Card card) {
        cardsPlayedThisTurn++;
        cardsPlayedThisCombat++;
        if (card.getType() == CardType.SKILL) {
            skillsPlayedThisTurn++;
        }
        if (card.getType() == CardType.ATTACK) {
            attacksPlayedThisTurn++;
            if (!firstAttackPlayed) {
                firstAttackPlayed = true;
                return true;
            }
        }
        return false;
    }

    void resetTurnCounters() {
        cardsPlayedThisTurn = 0;
        attacksPlayedThisTurn = 0;
        skillsPlayedThisTurn = 0;
        retainHandThisTurn = false;
    }

    public int getCardsPlayedThisTurn() {
        return cardsPlayedThisTurn;
    }

    public int getAttacksPlayedThisTurn() {
        return attacksPlayedThisTurn;
    }

    public int getSkillsPlayedThisTurn() {
        return skillsPlayedThisTurn;
    }

    public int getCardsPlayedThisCombat() {
        return cardsPlayedThisCombat;
    }

    public boolean isFirstAttackPlayed() {
        return firstAttackPlayed;
    }

    public void addDoublePlayCharges(int charges) {
        doublePlayCharges += Math.max(0, charges);
    }

    public int getDoublePlayCharges() {
        return doublePlayCharges;
    }

    /**
     * Spend one "play the next card twice" charge if there is one.
     */
    boolean consumeDoublePlay() {
        if (doublePlayCharges > 0) {
            doublePlayCharges--;
            return true;
        }
        return false;
    }

    public boolean isRetainHandThisTurn() {
        return retainHandThisTurn;
    }

    public void setRetainHandThisTurn(boolean retain) {
        this.retainHandThisTurn = retain;
    }

    /**
     * Id to record on events: the combatant's id.
     */
    public static String idOf(Combatant combatant) {
        return combatant == null ? null : combatant.getId();
    }
}
