package com.descent.engine.enemy;

import com.descent.engine.card.Effect;
import com.descent.engine.combat.AbstractCombatant;
import com.descent.engine.combat.CombatConstants;
import com.descent.engine.combat.Combatant;
import com.descent.engine.combat.DamageCalculator;
import com.descent.engine.combat.StatusEffect;
import com.descent.engine.rng.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An enemy in combat: a combatant with a move table and a committed intent.
 */
public class Enemy extends AbstractCombatant {
    private final EnemyTemplate template;
    private final List<String> moveHistory = new ArrayList<>();
    private EnemyMove committedMove;

    public Enemy(String instanceId, EnemyTemplate template, int maxHp) {
        super(instanceId, template.getName(), maxHp);
        this.template = template;
        if (template.getMoves().isEmpty()) {
            throw new IllegalArgumentException("Enemy " + template.getId() + " has no moves");
        }
        for (Map.Entry<StatusEffect, Integer> entry : template.getStartingStatus().entrySet()) {
            applyStatus(entry.getKey(), entry.getValue());
        }
    }

    public EnemyTemplate getTemplate() {
        return template;
    }

    public EnemyType getType() {
        return template.getType();
    }

    /**
     * Choose and commit the next move.
     */
    public EnemyMove rollMove(RandomSource rng) {
        EnemyMove selected = MoveSelector.select(template.getMoves(), moveHistory, template.isAntiRepeat(), rng);
        committedMove = selected;
        moveHistory.add(selected.getName());
        while (moveHistory.size() > CombatConstants.MOVE_HISTORY_SIZE) {
            moveHistory.remove(0);
        }
        return selected;
    }

    /**
     * Return the committed move's actions and immediately roll the next intent.
     */
    public List<Effect> executeMove(RandomSource rng) {
        if (committedMove == null) {
            rollMove(rng);
        }
        List<Effect> actions = committedMove.getActions();
        rollMove(rng);
        return actions;
    }

    public EnemyMove getCommittedMove() {
        return committedMove;
    }

    public Intent getIntent() {
        return committedMove == null ? Intent.of(IntentType.UNKNOWN) : committedMove.getIntent();
    }

    /**
     * Oldest first, at most three names.
     */
    public List<String> getMoveHistory() {
        return List.copyOf(moveHistory);
    }

    /**
     * Displayed attack number per hit: base + strength, reduced by weak. 0 for non-attacks.
     */
    public int getIntentValue() {
        Intent intent = getIntent();
        if (!intent.type().isAttack()) {
            return 0;
        }
        return DamageCalculator.outgoingDamage(intent.value(),
                getStatus(StatusEffect.STRENGTH), getStatus(StatusEffect.WEAK));
    }

    /**
     * Per-hit damage the committed attack would deal to the given target right now.
     */
    public int getIntentDamageAgainst(Combatant target) {
        Intent intent = getIntent();
        if (!intent.type().isAttack()) {
            return 0;
        }
        return DamageCalculator.intentDamage(intent.value(),
                getStatus(StatusEffect.STRENGTH), getStatus(StatusEffect.WEAK),
                target.getStatus(StatusEffect.VULNERABLE), target.getStatus(StatusEffect.INTANGIBLE));
    }

    @Override
    public String toString() {
        return super.toString() + " intends " + getIntent().type();
    }
}
