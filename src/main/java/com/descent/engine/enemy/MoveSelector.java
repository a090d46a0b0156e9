package com.descent.engine.enemy;

import com.descent.engine.rng.RandomSource;

import java.util.List;

/**
 * Weighted move choice with the anti-repeat rule.
 */
public final class MoveSelector {

    private MoveSelector() {
        // Utility class - prevent instantiation
    }

    /**
     * Pick the next move.
     *
     * @param moves      move table, non-empty
     * @param history    previously committed move names, oldest first
     * @param antiRepeat whether the last move may not be picked twice in a row
     * @param rng        random source
     */
    public static EnemyMove select(List<EnemyMove> moves, List<String> history, boolean antiRepeat, RandomSource rng) {
        if (moves.isEmpty()) {
            throw new IllegalArgumentException("Move table is empty");
        }
        EnemyMove selected = weightedPick(moves, rng);

        if (!antiRepeat || history.isEmpty()) {
            return selected;
        }
        String last = history.get(history.size() - 1);
        if (!selected.getName().equals(last)) {
            return selected;
        }

        List<EnemyMove> others = moves.stream()
                .filter(m -> !m.getName().equals(last))
                .filter(m -> m.getWeight() > 0)
                .toList();
        if (others.isEmpty()) {
            // Nothing else can be picked
            return selected;
        }
        return weightedPick(others, rng);
    }

    /**
     * Walk the table subtracting weights from r in [0, total) until r drops to 0 or below.
     * Zero-weight moves are never picked unless every weight is zero.
     */
    static EnemyMove weightedPick(List<EnemyMove> moves, RandomSource rng) {
        int totalWeight = moves.stream().mapToInt(EnemyMove::getWeight).sum();
        if (totalWeight <= 0) {
            return moves.get(rng.nextInt(moves.size()));
        }

        double r = rng.next() * totalWeight;
        EnemyMove lastPositive = null;
        for (EnemyMove move : moves) {
            if (move.getWeight() == 0) {
                continue;
            }
            lastPositive = move;
            r -= move.getWeight();
            if (r <= 0) {
                return move;
            }
        }
        return lastPositive;
    }
}
