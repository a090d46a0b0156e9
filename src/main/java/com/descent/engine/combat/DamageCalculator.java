package com.descent.engine.combat;

/**
 * Pure damage and block arithmetic.
 * Fractional multipliers always floor; nothing here rounds or mutates.
 */
public final class DamageCalculator {

    private DamageCalculator() {
        // Utility class - prevent instantiation
    }

    /**
     * Outcome of applying final damage to hp and block.
     * hpLost is not capped by hp; clamping to 0 HP is the caller's job.
     */
    public record DamageResult(int totalDamage, int blocked, int hpLost, int remainingBlock, boolean lethal) {}

    public record BlockResult(int blockGained, boolean frailApplied) {}

    public record PoisonTick(int damage, int remainingStacks) {}

    public record PlatedArmorTick(int blockGranted, int remainingStacks) {}

    /**
     * Attacker-side damage: strength is added, then weak reduces.
     */
    public static int outgoingDamage(int base, int attackerStrength, int attackerWeak) {
        int damage = base + attackerStrength;
        if (attackerWeak > 0) {
            damage = floor(damage * CombatConstants.WEAK_MULTIPLIER);
        }
        return Math.max(0, damage);
    }

    /**
     * Target-side damage. Intangible caps every hit to 1 and overrides vulnerable.
     */
    public static int incomingDamage(int damage, int targetVulnerable, int targetIntangible) {
        if (targetIntangible > 0) {
            return CombatConstants.INTANGIBLE_DAMAGE;
        }
        int result = damage;
        if (targetVulnerable > 0) {
            result = floor(result * CombatConstants.VULNERABLE_MULTIPLIER);
        }
        return Math.max(0, result);
    }

    /**
     * Full pipeline for one hit: outgoing, then incoming.
     */
    public static int finalDamage(int base, int attackerStrength, int attackerWeak,
                                  int targetVulnerable, int targetIntangible) {
        int outgoing = outgoingDamage(base, attackerStrength, attackerWeak);
        return incomingDamage(outgoing, targetVulnerable, targetIntangible);
    }

    public static DamageResult applyDamage(int damage, int hp, int block) {
        int blocked = Math.min(damage, block);
        int hpLost = Math.max(0, damage - block);
        int remainingBlock = Math.max(0, block - damage);
        boolean lethal = hp - hpLost <= 0;
        return new DamageResult(damage, blocked, hpLost, remainingBlock, lethal);
    }

    public static BlockResult calculateBlock(int base, int dexterity, int frail) {
        int block = base + dexterity;
        boolean frailApplied = false;
        if (frail > 0) {
            block = floor(block * CombatConstants.FRAIL_MULTIPLIER);
            frailApplied = true;
        }
        return new BlockResult(Math.max(0, block), frailApplied);
    }

    public static PoisonTick poisonTick(int stacks) {
        if (stacks <= 0) {
            return new PoisonTick(0, 0);
        }
        return new PoisonTick(stacks, stacks - 1);
    }

    public static PlatedArmorTick platedArmorTick(int stacks, boolean tookUnblockedDamageThisTurn) {
        if (stacks <= 0) {
            return new PlatedArmorTick(0, 0);
        }
        int remaining = tookUnblockedDamageThisTurn ? Math.max(0, stacks - 1) : stacks;
        return new PlatedArmorTick(stacks, remaining);
    }

    public static int thornsDamage(int stacks) {
        return Math.max(0, stacks);
    }

    /**
     * Damage an enemy intent would deal to the player right now.
     */
    public static int intentDamage(int base, int enemyStrength, int enemyWeak,
                                   int playerVulnerable, int playerIntangible) {
        return finalDamage(base, enemyStrength, enemyWeak, playerVulnerable, playerIntangible);
    }

    public static boolean wouldBeLethal(int damage, int hp, int block) {
        return applyDamage(damage, hp, block).lethal();
    }

    /**
     * HP plus block: how much raw damage a combatant can absorb.
     */
    public static int effectiveHp(int hp, int block) {
        return hp + block;
    }

    public static int overkill(int damage, int hp, int block) {
        return Math.max(0, damage - effectiveHp(hp, block));
    }

    // Truncation toward zero; callers clamp negatives afterwards
    private static int floor(double value) {
        return (int) value;
    }
}
