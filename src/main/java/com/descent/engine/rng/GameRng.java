package com.descent.engine.rng;

import java.security.SecureRandom;

/**
 * Seeded random number generator for reproducible combats.
 * Mulberry32, so a seed replays the same shuffles and enemy rolls.
 */
public class GameRng implements RandomSource {
    private final long seed;
    private long state;

    /**
     * Create a new GameRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.seed = seed & 0xFFFFFFFFL;
        this.state = this.seed;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Generate next random number in [0, 1).
     */
    @Override
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;
        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;

        return result / 4294967296.0;
    }

    /**
     * Fork an independent generator from this one, e.g. one per simulated combat.
     */
    public GameRng fork() {
        return new GameRng((long) (next() * 4294967296.0));
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
