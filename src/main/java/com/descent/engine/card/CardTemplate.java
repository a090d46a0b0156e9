package com.descent.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable card definition as loaded from the catalog.
 * Runtime copies are {@link Card} instances.
 */
public class CardTemplate {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description = "";

    @JsonProperty("type")
    private CardType type;

    @JsonProperty("rarity")
    private Rarity rarity = Rarity.COMMON;

    @JsonProperty("cost")
    private int cost;

    @JsonProperty("target_type")
    private TargetType targetType = TargetType.SELF;

    @JsonProperty("effects")
    private List<Effect> effects = new ArrayList<>();

    @JsonProperty("exhaust")
    private boolean exhaust;

    @JsonProperty("retain")
    private boolean retain;

    @JsonProperty("innate")
    private boolean innate;

    @JsonProperty("ethereal")
    private boolean ethereal;

    @JsonProperty("is_x_cost")
    private boolean xCost;

    @JsonProperty("upgrade")
    private CardUpgrade upgrade;

    public CardTemplate() {
    }

    public CardTemplate(String id, String name, CardType type, int cost, TargetType targetType, List<Effect> effects) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.cost = cost;
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

    public CardType getType() {
        return type;
    }

    public Rarity getRarity() {
        return rarity;
    }

    public int getCost() {
        return cost;
    }

    public TargetType getTargetType() {
        return targetType;
    }

    public List<Effect> getEffects() {
        return List.copyOf(effects);
    }

    public boolean isExhaust() {
        return exhaust;
    }

    public boolean isRetain() {
        return retain;
    }

    public boolean isInnate() {
        return innate;
    }

    public boolean isEthereal() {
        return ethereal;
    }

    public boolean isXCost() {
        return xCost;
    }

    public CardUpgrade getUpgrade() {
        return upgrade;
    }

    public boolean canUpgrade() {
        return upgrade != null;
    }

    // ---- Builder-style setters for templates built in code ----

    public CardTemplate description(String description) {
        this.description = description;
        return this;
    }

    public CardTemplate rarity(Rarity rarity) {
        this.rarity = rarity;
        return this;
    }

    public CardTemplate exhaust(boolean exhaust) {
        this.exhaust = exhaust;
        return this;
    }

    public CardTemplate retain(boolean retain) {
        this.retain = retain;
        return this;
    }

    public CardTemplate innate(boolean innate) {
        this.innate = innate;
        return this;
    }

    public CardTemplate ethereal(boolean ethereal) {
        this.ethereal = ethereal;
        return this;
    }

    public CardTemplate xCost(boolean xCost) {
        this.xCost = xCost;
        return this;
    }

    public CardTemplate upgrade(CardUpgrade upgrade) {
        this.upgrade = upgrade;
        return this;
    }
}
