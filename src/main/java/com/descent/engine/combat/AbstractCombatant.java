package com.descent.engine.combat;

/**
 * HP, block and status bookkeeping common to the player and enemies.
 */
public abstract class AbstractCombatant implements Combatant {
    private final String id;
    private final String name;
    private int maxHp;
    private int currentHp;
    private int block;
    private final StatusBag status = new StatusBag();
    private boolean tookUnblockedDamage;

    protected AbstractCombatant(String id, String name, int maxHp) {
        if (maxHp <= 0) {
            throw new IllegalArgumentException("maxHp must be positive: " + maxHp);
        }
        this.id = id;
        this.name = name;
        this.maxHp = maxHp;
        this.currentHp = maxHp;
    }

    /**
     * Whether block survives the start-of-turn reset.
     */
    protected boolean retainsBlock() {
        return false;
    }

    // ---- Accessors ----
    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getMaxHp() {
        return maxHp;
    }

    @Override
    public int getCurrentHp() {
        return currentHp;
    }

    @Override
    public int getBlock() {
        return block;
    }

    @Override
    public StatusBag getStatus() {
        return status;
    }

    public boolean tookUnblockedDamageThisTurn() {
        return tookUnblockedDamage;
    }

    protected void setCurrentHp(int hp) {
        this.currentHp = Math.max(0, Math.min(hp, maxHp));
        checkInvariants();
    }

    protected void setBlock(int block) {
        this.block = Math.max(0, block);
    }

    // ---- Mutators ----
    @Override
    public DamageCalculator.DamageResult takeHit(int rawDamage, Combatant attacker) {
        int outgoing = attacker == null
                ? Math.max(0, rawDamage)
                : DamageCalculator.outgoingDamage(rawDamage,
                        attacker.getStatus(StatusEffect.STRENGTH),
                        attacker.getStatus(StatusEffect.WEAK));
        int incoming = DamageCalculator.incomingDamage(outgoing,
                status.get(StatusEffect.VULNERABLE),
                status.get(StatusEffect.INTANGIBLE));
        return commitHit(incoming);
    }

    @Override
    public int takeRawHit(int damage) {
        return commitHit(Math.max(0, damage)).hpLost();
    }

    private DamageCalculator.DamageResult commitHit(int damage) {
        DamageCalculator.DamageResult result = DamageCalculator.applyDamage(damage, currentHp, block);
        block = result.remainingBlock();
        if (result.hpLost() > 0) {
            tookUnblockedDamage = true;
            setCurrentHp(currentHp - result.hpLost());
        }
        return result;
    }

    @Override
    public void gainBlock(int amount) {
        if (amount > 0) {
            block += amount;
        }
    }

    @Override
    public int gainCalculatedBlock(int base) {
        DamageCalculator.BlockResult result = DamageCalculator.calculateBlock(base,
                status.get(StatusEffect.DEXTERITY), status.get(StatusEffect.FRAIL));
        gainBlock(result.blockGained());
        return result.blockGained();
    }

    @Override
    public int heal(int amount) {
        if (isDead() || amount <= 0) {
            return 0;
        }
        int before = currentHp;
        setCurrentHp(currentHp + amount);
        return currentHp - before;
    }

    @Override
    public int loseHp(int amount) {
        if (amount <= 0) {
            return 0;
        }
        int before = currentHp;
        setCurrentHp(currentHp - amount);
        return before - currentHp;
    }

    @Override
    public void increaseMaxHp(int amount) {
        if (amount <= 0) {
            return;
        }
        maxHp += amount;
        if (isAlive()) {
            currentHp += amount;
        }
    }

    @Override
    public void applyStatus(StatusEffect effect, int amount) {
        status.apply(effect, amount);
    }

    @Override
    public boolean tryConsumeArtifact() {
        if (status.get(StatusEffect.ARTIFACT) > 0) {
            status.decrement(StatusEffect.ARTIFACT);
            return true;
        }
        return false;
    }

    @Override
    public TurnStartTick tickStartOfTurn() {
        int cleared = 0;
        if (!retainsBlock()) {
            cleared = block;
            block = 0;
        }

        DamageCalculator.PoisonTick poison = DamageCalculator.poisonTick(status.get(StatusEffect.POISON));
        int poisonDamage = 0;
        if (poison.damage() > 0) {
            poisonDamage = loseHp(poison.damage());
            status.set(StatusEffect.POISON, poison.remainingStacks());
        }

        status.decrement(StatusEffect.INTANGIBLE);
        return new TurnStartTick(cleared, poisonDamage);
    }

    @Override
    public TurnEndTick tickEndOfTurn() {
        status.decrement(StatusEffect.WEAK);
        status.decrement(StatusEffect.VULNERABLE);
        status.decrement(StatusEffect.FRAIL);

        int ritual = status.get(StatusEffect.RITUAL);
        if (ritual > 0) {
            status.apply(StatusEffect.STRENGTH, ritual);
        }

        int regenHealed = 0;
        int regen = status.get(StatusEffect.REGEN);
        if (regen > 0) {
            regenHealed = heal(regen);
            status.decrement(StatusEffect.REGEN);
        }

        DamageCalculator.PlatedArmorTick plated = DamageCalculator.platedArmorTick(
                status.get(StatusEffect.PLATED_ARMOR), tookUnblockedDamage);
        if (plated.blockGranted() > 0 && isAlive()) {
            gainBlock(plated.blockGranted());
        }
        status.set(StatusEffect.PLATED_ARMOR, plated.remainingStacks());
        tookUnblockedDamage = false;

        return new TurnEndTick(plated.blockGranted(), regenHealed, Math.max(0, ritual));
    }

    /**
     * Wipe block, statuses and per-turn flags for a fresh combat.
     */
    public void resetCombatState() {
        block = 0;
        status.clear();
        tookUnblockedDamage = false;
    }

    private void checkInvariants() {
        if (currentHp < 0 || currentHp > maxHp) {
            throw new IllegalStateException(name + " hp out of range: " + currentHp + "/" + maxHp);
        }
    }

    @Override
    public String toString() {
        return name + " (" + currentHp + "/" + maxHp + " hp, " + block + " block)";
    }
}
