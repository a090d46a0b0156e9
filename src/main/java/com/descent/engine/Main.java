package com.descent.engine;

import com.descent.engine.card.CardTemplate;
import com.descent.engine.catalog.Catalog;
import com.descent.engine.catalog.CatalogException;
import com.descent.engine.enemy.EnemyTemplate;
import com.descent.engine.potion.Potion;
import com.descent.engine.relic.RelicTemplate;
import com.descent.engine.simulation.CombatOutcome;
import com.descent.engine.simulation.CombatSimulator;
import com.descent.engine.simulation.Deck;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.Callable;

/**
 * Descent combat simulator CLI.
 */
@Command(name = "descent-engine",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Descent combat engine simulator",
        subcommands = {
                Main.SimulateCommand.class,
                Main.CatalogCommand.class
        })
public class Main implements Runnable {

    static final String DEFAULT_DECK_RESOURCE = "decks/starter.txt";

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    // ========== SIMULATE COMMAND ==========
    @Command(name = "simulate", description = "Run combats with the built-in autopilot")
    static class SimulateCommand implements Callable<Integer> {
        @Option(names = {"-n", "--num-combats"}, defaultValue = "100",
                description = "Number of combats to simulate")
        int numCombats;

        @Option(names = {"-s", "--seed"},
                description = "Random seed (optional)")
        Long seed;

        @Option(names = {"-v", "--verbose"},
                description = "Verbose output (trace of the first combat)")
        boolean verbose;

        @Option(names = {"-d", "--deck"},
                description = "Path to deck file (defaults to the bundled starter deck)")
        String deckPath;

        @Option(names = {"-c", "--catalog"},
                description = "Directory with cards.json, enemies.json, relics.json and potions.json")
        String catalogDir;

        @Option(names = {"-e", "--enemies"}, split = ",", defaultValue = "cave_crawler",
                description = "Comma separated enemy ids")
        List<String> enemyIds;

        @Option(names = {"-r", "--relics"}, split = ",",
                description = "Comma separated relic ids")
        List<String> relicIds = new ArrayList<>();

        @Option(names = {"-p", "--potions"}, split = ",",
                description = "Comma separated potion ids")
        List<String> potionIds = new ArrayList<>();

        @Option(names = {"--hp"}, defaultValue = "80",
                description = "Player max HP")
        int playerHp;

        @Override
        public Integer call() {
            Catalog catalog;
            try {
                catalog = loadCatalog(catalogDir);
            } catch (CatalogException e) {
                System.err.println("✗ Failed to load catalog: " + e.getMessage());
                return 1;
            }

            Deck deck;
            try {
                deck = loadDeck(deckPath, catalog);
            } catch (Deck.DeckException e) {
                System.err.println("✗ Failed to parse deck: " + e.getMessage());
                return 1;
            }

            long firstSeed = seed != null ? seed : System.nanoTime();
            System.out.println("\n=== Descent Combat Simulator ===\n");
            System.out.println("Deck: " + deck.getName() + " (" + deck.size() + " cards)");
            System.out.println("Enemies: " + String.join(", ", enemyIds));
            if (!relicIds.isEmpty()) {
                System.out.println("Relics: " + String.join(", ", relicIds));
            }
            System.out.println("Combats: " + numCombats);
            System.out.println("Seed: " + firstSeed);
            System.out.println();

            CombatSimulator.Setup setup = new CombatSimulator.Setup(deck, enemyIds, relicIds, potionIds, playerHp);
            long startTime = System.currentTimeMillis();
            List<CombatOutcome> results;
            try {
                results = CombatSimulator.runMany(catalog, setup, firstSeed, numCombats, verbose);
            } catch (CatalogException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
            long elapsed = System.currentTimeMillis() - startTime;

            printResults(results, numCombats, elapsed);
            return 0;
        }
    }

    // ========== CATALOG COMMAND ==========
    @Command(name = "catalog", description = "List catalog contents")
    static class CatalogCommand implements Callable<Integer> {
        @Option(names = {"-c", "--catalog"},
                description = "Catalog directory (defaults to the bundled catalog)")
        String catalogDir;

        @Override
        public Integer call() {
            Catalog catalog;
            try {
                catalog = loadCatalog(catalogDir);
            } catch (CatalogException e) {
                System.err.println("✗ Failed to load catalog: " + e.getMessage());
                return 1;
            }

            System.out.println("Cards (" + catalog.cardCount() + "):");
            catalog.getCards().stream()
                    .sorted(Comparator.comparing(CardTemplate::getId))
                    .forEach(c -> System.out.printf("  %-18s %-8s %s%n", c.getId(), c.getType(),
                            c.isXCost() ? "X" : String.valueOf(c.getCost())));

            System.out.println("\nEnemies (" + catalog.enemyCount() + "):");
            catalog.getEnemies().stream()
                    .sorted(Comparator.comparing(EnemyTemplate::getId))
                    .forEach(e -> System.out.printf("  %-18s %-7s %d hp%n", e.getId(), e.getType(), e.getMaxHp()));

            System.out.println("\nRelics (" + catalog.relicCount() + "):");
            catalog.getRelics().stream()
                    .sorted(Comparator.comparing(RelicTemplate::getId))
                    .forEach(r -> System.out.println("  " + r.getId()));

            System.out.println("\nPotions (" + catalog.potionCount() + "):");
            catalog.getPotions().stream()
                    .sorted(Comparator.comparing(Potion::getId))
                    .forEach(p -> System.out.println("  " + p.getId()));
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    static Catalog loadCatalog(String catalogDir) throws CatalogException {
        Catalog catalog = catalogDir == null
                ? Catalog.fromResources("catalog")
                : Catalog.fromDirectory(Path.of(catalogDir));
        System.err.println("✓ Loaded " + catalog.cardCount() + " cards, " + catalog.enemyCount() + " enemies, "
                + catalog.relicCount() + " relics, " + catalog.potionCount() + " potions");
        return catalog;
    }

    static Deck loadDeck(String deckPath, Catalog catalog) throws Deck.DeckException {
        if (deckPath != null) {
            return Deck.loadFromFile(deckPath, catalog);
        }
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream(DEFAULT_DECK_RESOURCE)) {
            if (in == null) {
                throw new Deck.DeckException("Bundled deck " + DEFAULT_DECK_RESOURCE + " is missing");
            }
            return Deck.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), "starter", catalog);
        } catch (IOException e) {
            throw new Deck.DeckException("Failed to read bundled deck: " + e.getMessage());
        }
    }

    /**
     * Print simulation results.
     */
    private static void printResults(List<CombatOutcome> results, int numCombats, long elapsedMs) {
        List<CombatOutcome> wins = results.stream().filter(CombatOutcome::isWin).toList();
        double winRate = numCombats == 0 ? 0.0 : (double) wins.size() / numCombats;
        double avgTurns = results.stream().mapToInt(CombatOutcome::turns).average().orElse(0.0);
        double avgHpLeft = wins.stream().mapToInt(CombatOutcome::hpRemaining).average().orElse(0.0);
        double avgCards = results.stream().mapToInt(CombatOutcome::cardsPlayed).average().orElse(0.0);

        Map<Integer, Long> turnDist = new TreeMap<>();
        for (CombatOutcome r : wins) {
            turnDist.merge(r.turns(), 1L, Long::sum);
        }

        System.out.println("=== Results ===\n");
        System.out.printf("Win rate: %.1f%% (%d/%d)%n", winRate * 100.0, wins.size(), numCombats);
        System.out.printf("Average turns: %.2f%n", avgTurns);
        System.out.printf("Average HP left on a win: %.1f%n", avgHpLeft);
        System.out.printf("Average cards played: %.1f%n", avgCards);
        System.out.println();

        System.out.println("Winning turn distribution:");
        for (Map.Entry<Integer, Long> entry : turnDist.entrySet()) {
            double pct = (double) entry.getValue() / numCombats * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf("  Turn %2d: %5.1f%% %s (%d)%n",
                    entry.getKey(), pct, bar, entry.getValue());
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double perSec = elapsedSec > 0 ? numCombats / elapsedSec : 0;
        System.out.printf("Simulation completed in %.2fs (%.0f combats/sec)%n", elapsedSec, perSec);
    }
}
