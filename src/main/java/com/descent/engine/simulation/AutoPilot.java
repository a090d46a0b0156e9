package com.descent.engine.simulation;

import com.descent.engine.card.Card;
import com.descent.engine.combat.CombatConstants;
import com.descent.engine.combat.Player;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.game.CombatEngine;
import com.descent.engine.game.CombatState;
import com.descent.engine.potion.Potion;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Greedy policy used by the simulator.
 * Plays the most expensive legal card at the weakest enemy, drinks potions when low, then ends the turn.
 */
public final class AutoPilot {

    private AutoPilot() {
        // Utility class - no instantiation
    }

    /**
     * A card to play and the enemy to aim it at (-1 for no target).
     */
    public record Play(int handIndex, int targetIndex) {}

    /**
     * Index of the living enemy with the least HP, ties to the leftmost.
     */
    public static OptionalInt chooseTarget(CombatState state) {
        List<Enemy> enemies = state.getEnemies();
        int best = -1;
        for (int i = 0; i < enemies.size(); i++) {
            Enemy enemy = enemies.get(i);
            if (enemy.isDead()) {
                continue;
            }
            if (best < 0 || enemy.getCurrentHp() < enemies.get(best).getCurrentHp()) {
                best = i;
            }
        }
        return best < 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }

    /**
     * Next card to play, or empty to end the turn.
     * Priority: highest cost first (X-cost counts as all remaining energy), then hand order.
     */
    public static Optional<Play> chooseCard(CombatEngine engine) {
        CombatState state = engine.getState();
        int target = chooseTarget(state).orElse(-1);
        int energy = state.getPlayer().getEnergy();

        Play best = null;
        int bestCost = -1;
        List<Card> hand = state.getHand().getCards();
        for (int i = 0; i < hand.size(); i++) {
            Card card = hand.get(i);
            if (engine.validatePlay(i, target) != null) {
                continue;
            }
            // X-cost with nothing to spend does nothing
            if (card.isXCost() && energy == 0) {
                continue;
            }
            int cost = card.isXCost() ? energy : card.getCost();
            if (cost > bestCost) {
                best = new Play(i, target);
                bestCost = cost;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Slot of a potion worth drinking now: any potion once HP is at or below half.
     */
    public static OptionalInt choosePotion(CombatState state) {
        Player player = state.getPlayer();
        if (player.getCurrentHp() > player.getMaxHp() * CombatConstants.LOW_HP_THRESHOLD) {
            return OptionalInt.empty();
        }
        List<Potion> slots = player.getPotionSlots();
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i) != null) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
