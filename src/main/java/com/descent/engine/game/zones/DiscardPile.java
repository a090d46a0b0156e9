package com.descent.engine.game.zones;

import com.descent.engine.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * Discard pile. Shuffled back into the draw pile when that runs out.
 */
public class DiscardPile {
    private final List<Card> cards;

    public DiscardPile() {
        this.cards = new ArrayList<>();
    }

    public void clear() {
        cards.clear();
    }

    public void add(Card card) {
        cards.add(card);
    }

    public boolean remove(Card card) {
        return cards.remove(card);
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Remove and return every card.
     */
    public List<Card> takeAll() {
        List<Card> all = new ArrayList<>(cards);
        cards.clear();
        return all;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
