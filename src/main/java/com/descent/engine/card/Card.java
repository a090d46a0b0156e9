package com.descent.engine.card;

import java.util.List;
import java.util.Objects;

/**
 * A runtime card: a template plus an instance id and an upgrade flag.
 * Two cards are the same card when their instance ids match.
 */
public final class Card {
    private final long instanceId;
    private final CardTemplate template;
    private final boolean upgraded;

    // Effective values, resolved once from template + upgrade
    private final String name;
    private final int cost;
    private final List<Effect> effects;
    private final String description;
    private final boolean exhaust;
    private final boolean retain;
    private final boolean innate;
    private final boolean ethereal;

    public Card(CardTemplate template, long instanceId) {
        this(template, instanceId, false);
    }

    private Card(CardTemplate template, long instanceId, boolean upgraded) {
        this.template = Objects.requireNonNull(template, "template");
        this.instanceId = instanceId;
        this.upgraded = upgraded;

        CardUpgrade delta = upgraded ? template.getUpgrade() : null;
        this.name = upgraded ? template.getName() + "+" : template.getName();
        this.cost = delta != null && delta.getCost() != null ? delta.getCost() : template.getCost();
        this.effects = delta != null && delta.getEffects() != null
                ? List.copyOf(delta.getEffects())
                : template.getEffects();
        this.description = delta != null && delta.getDescription() != null
                ? delta.getDescription()
                : template.getDescription();
        this.exhaust = pick(delta == null ? null : delta.getExhaust(), template.isExhaust());
        this.retain = pick(delta == null ? null : delta.getRetain(), template.isRetain());
        this.innate = pick(delta == null ? null : delta.getInnate(), template.isInnate());
        this.ethereal = pick(delta == null ? null : delta.getEthereal(), template.isEthereal());
    }

    private static boolean pick(Boolean override, boolean base) {
        return override != null ? override : base;
    }

    /**
     * Upgraded copy with the same instance id.
     * Returns this card when it is already upgraded or has no upgrade.
     */
    public Card upgraded() {
        if (upgraded || !template.canUpgrade()) {
            return this;
        }
        return new Card(template, instanceId, true);
    }

    public boolean canUpgrade() {
        return !upgraded && template.canUpgrade();
    }

    /**
     * Unplayable: cost -1 without the X-cost keyword.
     */
    public boolean isPlayable() {
        return cost >= 0 || isXCost();
    }

    /**
     * Description with {n} replaced by the n-th effect's value.
     */
    public String renderDescription() {
        String text = description == null ? "" : description;
        for (int i = 0; i < effects.size(); i++) {
            text = text.replace("{" + i + "}", String.valueOf(effects.get(i).value()));
        }
        return text;
    }

    public long getInstanceId() {
        return instanceId;
    }

    public CardTemplate getTemplate() {
        return template;
    }

    public String getId() {
        return template.getId();
    }

    public String getName() {
        return name;
    }

    public CardType getType() {
        return template.getType();
    }

    public Rarity getRarity() {
        return template.getRarity();
    }

    public int getCost() {
        return cost;
    }

    public TargetType getTargetType() {
        return template.getTargetType();
    }

    public List<Effect> getEffects() {
        return effects;
    }

    public String getDescription() {
        return description;
    }

    public boolean isUpgraded() {
        return upgraded;
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
        return template.isXCost();
    }

    /**
     * Value of the first effect of the given kind, or 0.
     */
    public int effectValue(EffectType type) {
        return effects.stream()
                .filter(e -> e.type() == type)
                .mapToInt(Effect::value)
                .findFirst()
                .orElse(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Card other)) return false;
        return instanceId == other.instanceId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(instanceId);
    }

    @Override
    public String toString() {
        return name + "#" + instanceId;
    }
}
