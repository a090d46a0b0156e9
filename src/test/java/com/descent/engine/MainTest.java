package com.descent.engine;

import com.descent.engine.catalog.Catalog;
import com.descent.engine.catalog.CatalogException;
import com.descent.engine.simulation.Deck;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testCatalogCommand() {
        assertEquals(0, new CommandLine(new Main()).execute("catalog"));
    }

    @Test
    void testSimulateCommand() {
        int exit = new CommandLine(new Main()).execute("simulate", "-n", "3", "-s", "11", "-e", "ooze,cave_crawler");
        assertEquals(0, exit);
    }

    @Test
    void testSimulateWithUnknownEnemy() {
        assertEquals(1, new CommandLine(new Main()).execute("simulate", "-n", "1", "-s", "1", "-e", "dragon"));
    }

    @Test
    void testBundledStarterDeck() throws CatalogException, Deck.DeckException {
        Catalog catalog = Catalog.fromResources("catalog");
        Deck deck = Main.loadDeck(null, catalog);
        assertEquals("starter", deck.getName());
        assertEquals(10, deck.size());
    }
}
