package com.descent.engine.potion;

import com.descent.engine.card.Effect;
import com.descent.engine.card.Rarity;
import com.descent.engine.card.TargetType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A single-use potion. Potions are never upgraded, so the template is the instance.
 */
public class Potion {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description = "";

    @JsonProperty("rarity")
    private Rarity rarity = Rarity.COMMON;

    @JsonProperty("target_type")
    private TargetType targetType = TargetType.SELF;

    @JsonProperty("effects")
    private List<Effect> effects = new ArrayList<>();

    public Potion() {
    }

    public Potion(String id, String name, TargetType targetType, List<Effect> effects) {
        this.id = id;
        this.name = name;
        this.targetType = targetType;
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

    public TargetType getTargetType() {
        return targetType;
    }

    public List<Effect> getEffects() {
        return List.copyOf(effects);
    }

    public boolean requiresTarget() {
        return targetType.requiresTarget();
    }

    @Override
    public String toString() {
        return name;
    }
}
