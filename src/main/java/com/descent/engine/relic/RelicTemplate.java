package com.descent.engine.relic;

import com.descent.engine.card.Rarity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Relic definition as loaded from the catalog.
 */
public class RelicTemplate {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description = "";

    @JsonProperty("rarity")
    private Rarity rarity = Rarity.COMMON;

    @JsonProperty("effects")
    private List<RelicEffect> effects = new ArrayList<>();

    @JsonProperty("counter_reset")
    private CounterReset counterReset = CounterReset.NEVER;

    public RelicTemplate() {
    }

    public RelicTemplate(String id, String name, List<RelicEffect> effects) {
        this.id = id;
        this.name = name;
        this.effects = new ArrayList<>(effects);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Rarity getRarity() {
        return rarity;
    }

    public List<RelicEffect> getEffects() {
        return List.copyOf(effects);
    }

    public CounterReset getCounterReset() {
        return counterReset;
    }

    public RelicTemplate counterReset(CounterReset counterReset) {
        this.counterReset = counterReset;
        return this;
    }
}
