package com.descent.engine.simulation;

import com.descent.engine.catalog.Catalog;
import com.descent.engine.catalog.CatalogException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for automated combats against the bundled catalog.
 */
class CombatSimulatorTest {

    private static Catalog catalog;
    private static Deck starter;

    @BeforeAll
    static void load() throws CatalogException, Deck.DeckException {
        catalog = Catalog.fromResources("catalog");
        starter = Deck.parse("5 strike\n4 defend\n1 bash", "starter", catalog);
    }

    private static CombatSimulator.Setup setup(List<String> enemies, List<String> relics, List<String> potions) {
        return new CombatSimulator.Setup(starter, enemies, relics, potions, 80);
    }

    @Test
    void testCombatFinishes() throws CatalogException {
        CombatOutcome outcome = CombatSimulator.runCombat(catalog,
                setup(List.of("cave_crawler"), List.of(), List.of()), 1L, false);

        assertTrue(outcome.turns() >= 1);
        assertTrue(outcome.turns() <= CombatSimulator.MAX_TURNS + 1);
        assertTrue(outcome.cardsPlayed() > 0);
        assertEquals(80, outcome.maxHp());
        assertEquals(outcome.victory(), outcome.hpRemaining() > 0);
    }

    @Test
    void testSameSeedSameOutcome() throws CatalogException {
        CombatSimulator.Setup setup = setup(List.of("cave_crawler", "ooze"), List.of("war_drum"), List.of("blast_flask"));
        CombatOutcome first = CombatSimulator.runCombat(catalog, setup, 314L, false);
        CombatOutcome second = CombatSimulator.runCombat(catalog, setup, 314L, false);
        assertEquals(first, second);
    }

    @Test
    void testStarterDeckBeatsSingleCrawler() throws CatalogException {
        List<CombatOutcome> outcomes = CombatSimulator.runMany(catalog,
                setup(List.of("cave_crawler"), List.of(), List.of()), 100L, 20, false);

        assertEquals(20, outcomes.size());
        long wins = outcomes.stream().filter(CombatOutcome::isWin).count();
        assertTrue(wins >= 15, "Starter deck should usually beat one crawler, won " + wins);
    }

    @Test
    void testRelicsAndPotionsAreAccepted() throws CatalogException {
        CombatOutcome outcome = CombatSimulator.runCombat(catalog,
                setup(List.of("stone_golem"), List.of("ember_heart", "iron_anchor"), List.of("healing_draught")),
                7L, false);
        assertEquals(87, outcome.maxHp());
    }

    @Test
    void testUnknownEnemyFails() {
        assertThrows(CatalogException.class, () -> CombatSimulator.runCombat(catalog,
                setup(List.of("dragon"), List.of(), List.of()), 1L, false));
    }
}
