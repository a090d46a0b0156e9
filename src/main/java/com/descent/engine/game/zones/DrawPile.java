package com.descent.engine.game.zones;

import com.descent.engine.card.Card;
import com.descent.engine.rng.RandomSource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Draw pile - ordered stack of cards.
 * Top of the pile is at index 0.
 */
public class DrawPile {
    private Deque<Card> cards;

    public DrawPile() {
        this.cards = new ArrayDeque<>();
    }

    public void clear() {
        cards.clear();
    }

    public void addCard(Card card) {
        cards.addLast(card);
    }

    public void addAll(List<Card> toAdd) {
        toAdd.forEach(cards::addLast);
    }

    /**
     * Peek at the top card without removing it.
     */
    public Optional<Card> peekTop() {
        return Optional.ofNullable(cards.peekFirst());
    }

    /**
     * Look at up to n cards from the top without removing them.
     */
    public List<Card> peek(int n) {
        List<Card> top = new ArrayList<>(Math.max(0, n));
        for (Card card : cards) {
            if (top.size() >= n) {
                break;
            }
            top.add(card);
        }
        return top;
    }

    /**
     * Draw a card from the top of the pile.
     * @throws NoSuchElementException if the pile is empty
     */
    public Card draw() {
        Card card = cards.pollFirst();
        if (card == null) {
            throw new NoSuchElementException("Cannot draw from empty draw pile");
        }
        return card;
    }

    public void putOnTop(Card card) {
        cards.addFirst(card);
    }

    public void putOnBottom(Card card) {
        cards.addLast(card);
    }

    /**
     * Insert at a random position, top and bottom included.
     */
    public void insertRandom(Card card, RandomSource rng) {
        List<Card> list = new ArrayList<>(cards);
        list.add(rng.nextInt(list.size() + 1), card);
        cards = new ArrayDeque<>(list);
    }

    /**
     * Remove a specific card wherever it is.
     */
    public boolean remove(Card card) {
        return cards.remove(card);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Shuffle the pile using the provided RNG.
     */
    public void shuffle(RandomSource rng) {
        List<Card> list = new ArrayList<>(cards);
        rng.shuffle(list);
        cards = new ArrayDeque<>(list);
    }

    /**
     * Get an unmodifiable copy of the cards, top first.
     */
    public List<Card> getCards() {
        return List.copyOf(cards);
    }
}
