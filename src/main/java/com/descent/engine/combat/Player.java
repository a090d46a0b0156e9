package com.descent.engine.combat;

import com.descent.engine.card.Card;
import com.descent.engine.potion.Potion;
import com.descent.engine.relic.Relic;
import com.descent.engine.relic.RelicAction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The player: a combatant plus energy, deck, relics, potions and gold.
 * Deck, relics, potions and gold persist across combats within a run.
 */
public class Player extends AbstractCombatant {
    private int energy;
    private int maxEnergy;
    private int handSize;
    private int gold;
    private int bonusEnergyNextCombat;

    // Set by RETAIN_ALL_BLOCK for the rest of the combat
    private boolean retainBlockThisCombat;

    private final List<Card> deck = new ArrayList<>();
    private final List<Relic> relics = new ArrayList<>();
    private final List<Potion> potionSlots = new ArrayList<>();

    public Player(String name) {
        this(name, CombatConstants.PLAYER_MAX_HP);
    }

    public Player(String name, int maxHp) {
        super("player", name, maxHp);
        this.maxEnergy = CombatConstants.BASE_ENERGY;
        this.handSize = CombatConstants.HAND_SIZE;
        this.gold = CombatConstants.STARTING_GOLD;
        for (int i = 0; i < CombatConstants.POTION_SLOTS; i++) {
            potionSlots.add(null);
        }
    }

    @Override
    protected boolean retainsBlock() {
        return retainBlockThisCombat || relics.stream().anyMatch(r -> r.hasAction(RelicAction.RETAIN_BLOCK));
    }

    // ---- Energy ----
    public int getEnergy() {
        return energy;
    }

    public int getMaxEnergy() {
        return maxEnergy;
    }

    public void setMaxEnergy(int maxEnergy) {
        this.maxEnergy = Math.max(0, Math.min(maxEnergy, CombatConstants.MAX_ENERGY));
    }

    /**
     * Refill energy to the per-turn maximum.
     */
    public void resetEnergy() {
        energy = maxEnergy;
    }

    public void gainEnergy(int amount) {
        energy = Math.min(CombatConstants.MAX_ENERGY, energy + Math.max(0, amount));
    }

    /**
     * Lose energy, flooring at 0.
     */
    public void loseEnergy(int amount) {
        energy = Math.max(0, energy - Math.max(0, amount));
    }

    /**
     * @return false (and nothing spent) when there is not enough energy
     */
    public boolean spendEnergy(int amount) {
        if (amount < 0 || amount > energy) {
            return false;
        }
        energy -= amount;
        return true;
    }

    public int getHandSize() {
        return handSize;
    }

    public void setHandSize(int handSize) {
        this.handSize = Math.max(0, Math.min(handSize, CombatConstants.MAX_HAND_SIZE));
    }

    public int getBonusEnergyNextCombat() {
        return bonusEnergyNextCombat;
    }

    public void addBonusEnergyNextCombat(int amount) {
        bonusEnergyNextCombat += Math.max(0, amount);
    }

    /**
     * Hand over the stored bonus energy and clear it.
     */
    public int consumeBonusEnergy() {
        int bonus = bonusEnergyNextCombat;
        bonusEnergyNextCombat = 0;
        return bonus;
    }

    public boolean isRetainBlockThisCombat() {
        return retainBlockThisCombat;
    }

    public void setRetainBlockThisCombat(boolean retain) {
        this.retainBlockThisCombat = retain;
    }

    // ---- Gold ----
    public int getGold() {
        return gold;
    }

    public void gainGold(int amount) {
        gold += Math.max(0, amount);
    }

    /**
     * @return false when the player cannot afford it
     */
    public boolean spendGold(int amount) {
        if (amount < 0 || amount > gold) {
            return false;
        }
        gold -= amount;
        return true;
    }

    // ---- Deck ----
    public List<Card> getDeck() {
        return Collections.unmodifiableList(deck);
    }

    public void addCardToDeck(Card card) {
        deck.add(card);
    }

    public boolean removeCardFromDeck(Card card) {
        return deck.remove(card);
    }

    /**
     * Permanently upgrade a deck card.
     * @return false if the card is not in the deck or cannot be upgraded
     */
    public boolean upgradeDeckCard(Card card) {
        int index = deck.indexOf(card);
        if (index < 0 || !card.canUpgrade()) {
            return false;
        }
        deck.set(index, card.upgraded());
        return true;
    }

    // ---- Relics ----
    public List<Relic> getRelics() {
        return Collections.unmodifiableList(relics);
    }

    public boolean hasRelic(String relicId) {
        return relics.stream().anyMatch(r -> r.getId().equals(relicId));
    }

    /**
     * Add a relic. Relics are unique; a duplicate id is ignored.
     * @return false if already held
     */
    public boolean addRelic(Relic relic) {
        if (hasRelic(relic.getId())) {
            return false;
        }
        relics.add(relic);
        int extraSlots = relic.sumOf(RelicAction.POTION_SLOT);
        for (int i = 0; i < extraSlots; i++) {
            potionSlots.add(null);
        }
        return true;
    }

    // ---- Potions ----
    public int getPotionSlotCount() {
        return potionSlots.size();
    }

    /**
     * Slots in order; empty slots are null.
     */
    public List<Potion> getPotionSlots() {
        return Collections.unmodifiableList(potionSlots);
    }

    public Optional<Potion> getPotion(int slot) {
        if (slot < 0 || slot >= potionSlots.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(potionSlots.get(slot));
    }

    /**
     * Put a potion in the first free slot.
     * @return false when every slot is full
     */
    public boolean addPotion(Potion potion) {
        int free = potionSlots.indexOf(null);
        if (free < 0) {
            return false;
        }
        potionSlots.set(free, potion);
        return true;
    }

    /**
     * Take the potion out of its slot.
     * @return the potion, or null if the slot is empty or out of range
     */
    public Potion removePotion(int slot) {
        if (slot < 0 || slot >= potionSlots.size()) {
            return null;
        }
        Potion potion = potionSlots.get(slot);
        potionSlots.set(slot, null);
        return potion;
    }

    /**
     * Clear combat-only state: block, statuses, retention flag, energy refilled.
     */
    public void startCombat() {
        resetCombatState();
        retainBlockThisCombat = false;
        resetEnergy();
    }
}
