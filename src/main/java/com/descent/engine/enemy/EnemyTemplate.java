package com.descent.engine.enemy;

import com.descent.engine.combat.StatusEffect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Enemy definition as loaded from the catalog.
 */
public class EnemyTemplate {
    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private EnemyType type = EnemyType.NORMAL;

    @JsonProperty("max_hp")
    private int maxHp;

    @JsonProperty("moves")
    private List<EnemyMove> moves = new ArrayList<>();

    @JsonProperty("anti_repeat")
    private boolean antiRepeat = true;

    @JsonProperty("starting_status")
    private Map<StatusEffect, Integer> startingStatus = new EnumMap<>(StatusEffect.class);

    public EnemyTemplate() {
    }

    public EnemyTemplate(String id, String name, EnemyType type, int maxHp, List<EnemyMove> moves) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.maxHp = maxHp;
        this.moves = new ArrayList<>(moves);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public EnemyType getType() {
        return type;
    }

    public int getMaxHp() {
        return maxHp;
    }

    public List<EnemyMove> getMoves() {
        return List.copyOf(moves);
    }

    public boolean isAntiRepeat() {
        return antiRepeat;
    }

    public Map<StatusEffect, Integer> getStartingStatus() {
        return Map.copyOf(startingStatus);
    }

    public EnemyTemplate antiRepeat(boolean antiRepeat) {
        this.antiRepeat = antiRepeat;
        return this;
    }

    public EnemyTemplate startingStatus(StatusEffect effect, int amount) {
        this.startingStatus.put(effect, amount);
        return this;
    }
}
