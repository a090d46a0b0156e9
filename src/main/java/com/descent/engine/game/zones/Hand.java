package com.descent.engine.game.zones;

import com.descent.engine.card.Card;
import com.descent.engine.combat.CombatConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand - cards in hand, in draw order.
 */
public class Hand {
    private final List<Card> cards;

    public Hand() {
        this.cards = new ArrayList<>(CombatConstants.MAX_HAND_SIZE);
    }

    public void clear() {
        cards.clear();
    }

    public void add(Card card) {
        cards.add(card);
    }

    public Card get(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.get(index);
        }
        return null;
    }

    /**
     * Swap the card at index for another, e.g. after an upgrade.
     */
    public void set(int index, Card card) {
        cards.set(index, card);
    }

    /**
     * Remove a card by index.
     * @return The removed card, or null if index is out of bounds
     */
    public Card remove(int index) {
        if (index >= 0 && index < cards.size()) {
            return cards.remove(index);
        }
        return null;
    }

    /**
     * Remove a specific card from the hand.
     * @return true if the card was found and removed
     */
    public boolean remove(Card card) {
        return cards.remove(card);
    }

    public int indexOf(Card card) {
        return cards.indexOf(card);
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean isFull() {
        return cards.size() >= CombatConstants.MAX_HAND_SIZE;
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
