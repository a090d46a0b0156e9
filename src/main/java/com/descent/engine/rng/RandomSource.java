package com.descent.engine.rng;

import java.util.Collections;
import java.util.List;

/**
 * Uniform random draw in [0, 1).
 * Every random decision in a combat (shuffles, move rolls, random targets) goes through one source.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Next value in [0, 1).
     */
    double next();

    /**
     * Random integer in [0, bound).
     */
    default int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        int value = (int) Math.floor(next() * bound);
        return Math.min(value, bound - 1);
    }

    /**
     * Fisher-Yates shuffle in place.
     */
    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }
}
