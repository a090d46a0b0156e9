package com.descent.engine.simulation;

import com.descent.engine.card.Card;
import com.descent.engine.card.CardTemplate;
import com.descent.engine.catalog.Catalog;
import com.descent.engine.catalog.CatalogException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Deck list and its text format.
 */
public class Deck {
    private final List<Card> cards;
    private final String name;

    public Deck(List<Card> cards, String name) {
        this.cards = new ArrayList<>(cards);
        this.name = name;
    }

    /**
     * Load a deck from a file.
     * Format: "5 strike" per line, "+" after the id for upgraded copies, comments with # or //
     *
     * @param path    Path to the deck file
     * @param catalog Card catalog
     * @return Parsed deck
     * @throws DeckException if parsing fails
     */
    public static Deck loadFromFile(String path, Catalog catalog) throws DeckException {
        String content;
        try {
            content = Files.readString(Path.of(path));
        } catch (IOException e) {
            throw new DeckException("Failed to read deck file: " + e.getMessage());
        }

        String fileName = Path.of(path).getFileName().toString();
        String deckName = fileName.endsWith(".txt")
                ? fileName.substring(0, fileName.length() - 4)
                : fileName;
        return parse(content, deckName, catalog);
    }

    /**
     * Parse deck text.
     * @throws DeckException on a malformed line or unknown card id
     */
    public static Deck parse(String content, String deckName, Catalog catalog) throws DeckException {
        List<Card> cards = new ArrayList<>();
        String[] lines = content.split("\n");

        for (int lineNum = 0; lineNum < lines.length; lineNum++) {
            String line = lines[lineNum].trim();

            // Skip empty lines and comments
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
                continue;
            }

            int spaceIdx = line.indexOf(' ');
            if (spaceIdx == -1) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": Expected format 'COUNT CARD_ID'");
            }

            String countStr = line.substring(0, spaceIdx);
            String cardId = line.substring(spaceIdx + 1).trim();
            boolean upgraded = cardId.endsWith("+");
            if (upgraded) {
                cardId = cardId.substring(0, cardId.length() - 1);
            }

            int count;
            try {
                count = Integer.parseInt(countStr);
            } catch (NumberFormatException e) {
                throw new DeckException("Invalid deck format at line " + (lineNum + 1)
                        + ": '" + countStr + "' is not a valid number");
            }

            CardTemplate template;
            try {
                template = catalog.getCard(cardId);
            } catch (CatalogException e) {
                throw new DeckException("Card not found at line " + (lineNum + 1) + ": " + cardId);
            }
            for (int i = 0; i < count; i++) {
                Card card = catalog.newCard(template);
                cards.add(upgraded ? card.upgraded() : card);
            }
        }
        return new Deck(cards, deckName);
    }

    /**
     * Fresh copies of every card, so each combat gets its own instance ids.
     */
    public List<Card> instantiate(Catalog catalog) {
        List<Card> copies = new ArrayList<>(cards.size());
        for (Card card : cards) {
            Card copy = catalog.newCard(card.getTemplate());
            copies.add(card.isUpgraded() ? copy.upgraded() : copy);
        }
        return copies;
    }

    public List<Card> getCards() {
        return new ArrayList<>(cards);
    }

    public int size() {
        return cards.size();
    }

    public String getName() {
        return name;
    }

    /**
     * Exception thrown when deck parsing fails.
     */
    public static class DeckException extends Exception {
        public DeckException(String message) {
            super(message);
        }
    }
}
