package com.descent.engine.relic;

import com.descent.engine.game.LifecycleEvent;

import java.util.List;

/**
 * A relic held by the player, with its own counter.
 */
public class Relic {
    private final RelicTemplate template;
    private int counter;

    public Relic(RelicTemplate template) {
        this.template = template;
    }

    public String getId() {
        return template.getId();
    }

    public String getName() {
        return template.getName();
    }

    public RelicTemplate getTemplate() {
        return template;
    }

    public int getCounter() {
        return counter;
    }

    /**
     * @return the counter after incrementing
     */
    public int incrementCounter() {
        return ++counter;
    }

    public void resetCounter() {
        counter = 0;
    }

    public List<RelicEffect> getEffectsForTrigger(LifecycleEvent event) {
        return template.getEffects().stream()
                .filter(e -> e.firesOn(event))
                .toList();
    }

    /**
     * True if any effect of this relic uses the given action.
     */
    public boolean hasAction(RelicAction action) {
        return template.getEffects().stream()
                .anyMatch(e -> e.actionKind().orElse(null) == action);
    }

    /**
     * Sum of the values of every effect using the given action.
     */
    public int sumOf(RelicAction action) {
        return template.getEffects().stream()
                .filter(e -> e.actionKind().orElse(null) == action)
                .mapToInt(RelicEffect::getValue)
                .sum();
    }

    @Override
    public String toString() {
        return getName() + (counter > 0 ? " [" + counter + "]" : "");
    }
}
