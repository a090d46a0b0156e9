package com.descent.engine.simulation;

import com.descent.engine.catalog.Catalog;
import com.descent.engine.catalog.CatalogException;
import com.descent.engine.combat.Player;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.game.ActionResult;
import com.descent.engine.game.CombatEngine;
import com.descent.engine.game.CombatEvent;
import com.descent.engine.game.CombatPhase;
import com.descent.engine.rng.GameRng;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Runs whole combats with the {@link AutoPilot} policy.
 */
public final class CombatSimulator {
    private static final Logger logger = LogManager.getLogger(CombatSimulator.class.getName());

    /** Turn limit; a combat still running after it counts as a loss. */
    public static final int MAX_TURNS = 100;

    /** Upper bound on card plays in a single turn. */
    private static final int MAX_PLAYS_PER_TURN = 50;

    private CombatSimulator() {
        // Utility class - prevent instantiation
    }

    /**
     * What to fight with and against.
     *
     * @param deck       player deck
     * @param enemyIds   enemy templates, in roster order
     * @param relicIds   relics the player starts with
     * @param potionIds  potions the player starts with
     * @param playerHp   player max HP
     */
    public record Setup(Deck deck, List<String> enemyIds, List<String> relicIds, List<String> potionIds, int playerHp) {}

    /**
     * Run one combat with the given seed.
     * @throws CatalogException if the setup references an unknown enemy, relic or potion
     */
    public static CombatOutcome runCombat(Catalog catalog, Setup setup, long seed, boolean verbose)
            throws CatalogException {
        GameRng rng = new GameRng(seed);
        Player player = new Player("Player", setup.playerHp());
        setup.deck().instantiate(catalog).forEach(player::addCardToDeck);
        CombatEngine engine = new CombatEngine(catalog, rng, player);
        for (String relicId : setup.relicIds()) {
            engine.obtainRelic(catalog.createRelic(relicId));
        }
        for (String potionId : setup.potionIds()) {
            if (!engine.gainPotion(catalog.getPotion(potionId))) {
                logger.warn("No free slot for potion {}, dropped", potionId);
            }
        }

        List<Enemy> enemies = new ArrayList<>();
        for (String enemyId : setup.enemyIds()) {
            enemies.add(catalog.createEnemy(enemyId, rng));
        }

        report(verbose, engine.startCombat(enemies));
        while (!engine.isOver() && engine.getState().getTurn() <= MAX_TURNS) {
            if (verbose) {
                System.out.println("--- Turn " + engine.getState().getTurn() + ": " + player
                        + ", energy " + player.getEnergy() + " ---");
                engine.getEnemies().forEach(e -> System.out.println("  " + e + " (" + e.getIntentValue() + ")"));
            }
            playTurn(engine, verbose);
            if (!engine.isOver()) {
                report(verbose, engine.endTurn());
            }
        }

        boolean victory = engine.getPhase() == CombatPhase.VICTORY;
        if (!engine.isOver()) {
            logger.warn("Combat with seed {} still running after {} turns, counting as a loss", seed, MAX_TURNS);
        }
        if (verbose) {
            System.out.println("Result: " + engine.getPhase() + " on turn " + engine.getState().getTurn());
        }
        return new CombatOutcome(victory, engine.getState().getTurn(), player.getCurrentHp(), player.getMaxHp(),
                engine.getState().getCardsPlayedThisCombat());
    }

    /**
     * Run many combats with consecutive seeds.
     * @throws CatalogException if the setup references an unknown id
     */
    public static List<CombatOutcome> runMany(Catalog catalog, Setup setup, long firstSeed, int count, boolean verbose)
            throws CatalogException {
        List<CombatOutcome> outcomes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            outcomes.add(runCombat(catalog, setup, firstSeed + i, verbose && i == 0));
        }
        return outcomes;
    }

    private static void playTurn(CombatEngine engine, boolean verbose) {
        OptionalInt potion = AutoPilot.choosePotion(engine.getState());
        if (potion.isPresent()) {
            int target = AutoPilot.chooseTarget(engine.getState()).orElse(-1);
            report(verbose, engine.usePotion(potion.getAsInt(), target));
        }

        for (int plays = 0; plays < MAX_PLAYS_PER_TURN && !engine.isOver(); plays++) {
            Optional<AutoPilot.Play> play = AutoPilot.chooseCard(engine);
            if (play.isEmpty()) {
                return;
            }
            if (verbose) {
                System.out.println("  plays " + engine.getState().getHand().get(play.get().handIndex()).getName());
            }
            ActionResult result = engine.playCard(play.get().handIndex(), play.get().targetIndex());
            if (!result.success()) {
                logger.warn("AutoPilot chose an illegal play: {}", result.message());
                return;
            }
            report(verbose, result);
        }
    }

    private static void report(boolean verbose, ActionResult result) {
        if (!verbose) {
            return;
        }
        for (CombatEvent event : result.events()) {
            System.out.println("    " + event);
        }
    }
}
