package com.descent.engine.enemy;

import com.descent.engine.card.Effect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of an enemy's move table.
 */
public class EnemyMove {
    @JsonProperty("name")
    private String name;

    @JsonProperty("intent")
    private Intent intent = Intent.of(IntentType.UNKNOWN);

    @JsonProperty("weight")
    private int weight = 1;

    @JsonProperty("actions")
    private List<Effect> actions = new ArrayList<>();

    public EnemyMove() {
    }

    public EnemyMove(String name, Intent intent, int weight, List<Effect> actions) {
        this.name = name;
        this.intent = intent;
        this.weight = weight;
        this.actions = new ArrayList<>(actions);
    }

    public String getName() {
        return name;
    }

    public Intent getIntent() {
        return intent;
    }

    public int getWeight() {
        return Math.max(0, weight);
    }

    public List<Effect> getActions() {
        return List.copyOf(actions);
    }

    @Override
    public String toString() {
        return name + " (" + intent.type() + ")";
    }
}
