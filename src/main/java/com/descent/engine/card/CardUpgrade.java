package com.descent.engine.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Upgrade delta. Null fields keep the base template's value.
 */
public class CardUpgrade {
    @JsonProperty("cost")
    private Integer cost;

    @JsonProperty("effects")
    private List<Effect> effects;

    @JsonProperty("description")
    private String description;

    @JsonProperty("exhaust")
    private Boolean exhaust;

    @JsonProperty("retain")
    private Boolean retain;

    @JsonProperty("innate")
    private Boolean innate;

    @JsonProperty("ethereal")
    private Boolean ethereal;

    public CardUpgrade() {
    }

    public CardUpgrade(Integer cost, List<Effect> effects) {
        this.cost = cost;
        this.effects = effects == null ? null : List.copyOf(effects);
    }

    public Integer getCost() {
        return cost;
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public String getDescription() {
        return description;
    }

    public Boolean getExhaust() {
        return exhaust;
    }

    public Boolean getRetain() {
        return retain;
    }

    public Boolean getInnate() {
        return innate;
    }

    public Boolean getEthereal() {
        return ethereal;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public void setExhaust(Boolean exhaust) {
        this.exhaust = exhaust;
    }

    public void setRetain(Boolean retain) {
        this.retain = retain;
    }

    public void setInnate(Boolean innate) {
        this.innate = innate;
    }

    public void setEthereal(Boolean ethereal) {
        this.ethereal = ethereal;
    }
}
