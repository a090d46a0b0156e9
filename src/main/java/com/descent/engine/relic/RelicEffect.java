package com.descent.engine.relic;

import com.descent.engine.game.LifecycleEvent;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * One (trigger, action, value) triple of a relic.
 * The trigger is normalized when the effect is built.
 */
public final class RelicEffect {
    private final String trigger;
    private final String action;
    private final int value;
    private final Integer amount;

    @JsonCreator
    public RelicEffect(@JsonProperty("trigger") String trigger,
                       @JsonProperty("action") String action,
                       @JsonProperty("value") int value,
                       @JsonProperty("amount") Integer amount) {
        this.trigger = TriggerNormalizer.normalize(trigger);
        this.action = action == null ? "" : action.trim();
        this.value = value;
        this.amount = amount;
    }

    public RelicEffect(LifecycleEvent trigger, RelicAction action, int value) {
        this(trigger.name(), action.name(), value, null);
    }

    @JsonProperty("trigger")
    public String getTrigger() {
        return trigger;
    }

    @JsonProperty("action")
    public String getAction() {
        return action;
    }

    /**
     * Magnitude for direct actions, N for counter actions.
     */
    @JsonProperty("value")
    public int getValue() {
        return value;
    }

    /**
     * Payload of a counter action when it fires.
     */
    public int getPayload() {
        if (amount != null) {
            return amount;
        }
        return actionKind().map(RelicAction::getDefaultPayload).orElse(0);
    }

    public Optional<LifecycleEvent> triggerEvent() {
        return LifecycleEvent.fromName(trigger);
    }

    public Optional<RelicAction> actionKind() {
        return RelicAction.fromName(action);
    }

    public boolean firesOn(LifecycleEvent event) {
        return trigger.equals(event.name());
    }

    @Override
    public String toString() {
        return trigger + " -> " + action + "(" + value + ")";
    }
}
