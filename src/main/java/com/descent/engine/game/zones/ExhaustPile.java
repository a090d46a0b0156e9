package com.descent.engine.game.zones;

import com.descent.engine.card.Card;

import java.util.ArrayList;
import java.util.List;

/**
 * Exhaust pile - cards removed for the rest of the combat.
 */
public class ExhaustPile {
    private final List<Card> cards;

    public ExhaustPile() {
        this.cards = new ArrayList<>();
    }

    public void clear() {
        cards.clear();
    }

    public void add(Card card) {
        cards.add(card);
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

    /**
     * Get an unmodifiable copy of the cards.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
