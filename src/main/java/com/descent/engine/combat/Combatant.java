package com.descent.engine.combat;

/**
 * Shared shape of the player and every enemy.
 */
public interface Combatant {

    /**
     * Changes applied by a start-of-turn tick.
     */
    record TurnStartTick(int blockCleared, int poisonDamage) {}

    /**
     * Changes applied by an end-of-turn tick.
     */
    record TurnEndTick(int platedArmorBlock, int regenHealed, int ritualStrength) {}

    String getId();

    String getName();

    int getMaxHp();

    int getCurrentHp();

    int getBlock();

    StatusBag getStatus();

    default int getStatus(StatusEffect effect) {
        return getStatus().get(effect);
    }

    default boolean isDead() {
        return getCurrentHp() <= 0;
    }

    default boolean isAlive() {
        return !isDead();
    }

    /**
     * Run a hit through the outgoing, incoming and block pipeline and commit it.
     * A null attacker skips the outgoing (strength/weak) step.
     */
    DamageCalculator.DamageResult takeHit(int rawDamage, Combatant attacker);

    /**
     * Same as {@link #takeHit} but only reports the HP actually lost.
     */
    default int takeDamage(int rawDamage, Combatant attacker) {
        int before = getCurrentHp();
        takeHit(rawDamage, attacker);
        return before - getCurrentHp();
    }

    /**
     * Apply damage against block only, with no strength, weak, vulnerable or intangible.
     * @return HP lost
     */
    int takeRawHit(int damage);

    /**
     * Add raw block, no dexterity or frail.
     */
    void gainBlock(int amount);

    /**
     * Block from a card or move: dexterity and frail apply.
     * @return block actually gained
     */
    int gainCalculatedBlock(int base);

    /**
     * Heal up to max HP. Dead combatants cannot be healed.
     * @return HP restored
     */
    int heal(int amount);

    /**
     * Lose HP directly, ignoring block.
     * @return HP lost
     */
    int loseHp(int amount);

    void increaseMaxHp(int amount);

    /**
     * Apply a status using its stacking rule. Artifact is not checked here.
     */
    void applyStatus(StatusEffect effect, int amount);

    /**
     * If artifact is up, spend one stack and return true so the caller voids the debuff.
     */
    boolean tryConsumeArtifact();

    TurnStartTick tickStartOfTurn();

    TurnEndTick tickEndOfTurn();
}
