package com.descent.engine.game;

import com.descent.engine.card.Card;
import com.descent.engine.card.CardTemplate;
import com.descent.engine.card.CardType;
import com.descent.engine.card.CardUpgrade;
import com.descent.engine.card.Effect;
import com.descent.engine.card.EffectType;
import com.descent.engine.card.Rarity;
import com.descent.engine.card.TargetType;
import com.descent.engine.catalog.Catalog;
import com.descent.engine.catalog.CatalogException;
import com.descent.engine.combat.Combatant;
import com.descent.engine.combat.Player;
import com.descent.engine.combat.StatusEffect;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.enemy.EnemyMove;
import com.descent.engine.enemy.EnemyTemplate;
import com.descent.engine.enemy.EnemyType;
import com.descent.engine.enemy.Intent;
import com.descent.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EffectResolverTest {

    private Catalog catalog;
    private EffectResolver resolver;
    private CombatState state;
    private Player player;
    private Enemy first;
    private Enemy second;

    @BeforeEach
    void setUp() throws CatalogException {
        catalog = Catalog.builder()
                .card(new CardTemplate("strike", "Strike", CardType.ATTACK, 1, TargetType.SINGLE_ENEMY,
                        List.of(Effect.of(EffectType.DAMAGE, 6)))
                        .rarity(Rarity.STARTER)
                        .upgrade(new CardUpgrade(null, List.of(Effect.of(EffectType.DAMAGE, 9)))))
                .card(new CardTemplate("cleave", "Cleave", CardType.ATTACK, 1, TargetType.ALL_ENEMIES,
                        List.of(Effect.of(EffectType.DAMAGE_ALL, 8))))
                .card(new CardTemplate("rubble", "Rubble", CardType.STATUS, -1, TargetType.SELF, List.of())
                        .rarity(Rarity.SPECIAL))
                .enemy(new EnemyTemplate("dummy", "Dummy", EnemyType.NORMAL, 30,
                        List.of(new EnemyMove("Poke", Intent.attack(5), 1, List.of(Effect.of(EffectType.DAMAGE, 5))))))
                .build();
        resolver = new EffectResolver(catalog);
        player = new Player("Tester", 50);
        state = new CombatState(player, new GameRng(9));
        first = catalog.createEnemyExact("dummy");
        second = new Enemy("dummy#2", catalog.getEnemy("dummy"), 30);
        state.setEnemies(List.of(first, second));
        state.setPhase(CombatPhase.PLAYER_TURN);
    }

    private EffectContext cardContext(Enemy target) throws CatalogException {
        return EffectContext.forCard(state, catalog.createCard("strike"), target, 1);
    }

    @Test
    void testSingleTargetDamage() throws CatalogException {
        List<EffectResult> results = resolver.resolve(List.of(Effect.of(EffectType.DAMAGE, 6)), cardContext(second));
        assertEquals(30, first.getCurrentHp());
        assertEquals(24, second.getCurrentHp());
        assertEquals(6, results.get(0).value());
    }

    @Test
    void testNoTargetHaltsTheList() throws CatalogException {
        List<EffectResult> results = resolver.resolve(
                List.of(Effect.of(EffectType.DAMAGE, 6), Effect.of(EffectType.BLOCK, 5)), cardContext(null));
        assertEquals(1, results.size());
        assertFalse(results.get(0).shouldContinue());
        assertEquals(0, player.getBlock());
    }

    @Test
    void testDamageAllHitsEveryLivingEnemy() throws CatalogException {
        second.loseHp(30);
        resolver.resolve(List.of(Effect.of(EffectType.DAMAGE_ALL, 8)), cardContext(null));
        assertEquals(22, first.getCurrentHp());
        assertEquals(0, second.getCurrentHp());
    }

    @Test
    void testMultiHitStopsWhenCombatEnds() throws CatalogException {
        second.loseHp(30);
        first.loseHp(25);
        EffectResult result = resolver.resolveEffect(Effect.multiHit(EffectType.DAMAGE, 3, 4), cardContext(first));
        assertTrue(first.isDead());
        assertEquals(CombatPhase.VICTORY, state.getPhase());
        assertEquals(5, result.value());
        assertEquals(1, state.getEvents().count(LifecycleEvent.ENEMY_KILLED));
    }

    @Test
    void testDamageEqualBlock() throws CatalogException {
        player.gainBlock(11);
        resolver.resolve(List.of(Effect.of(EffectType.DAMAGE_EQUAL_BLOCK, 0)), cardContext(first));
        assertEquals(19, first.getCurrentHp());
        assertEquals(11, player.getBlock());
    }

    @Test
    void testCardBlockUsesDexterity() throws CatalogException {
        player.applyStatus(StatusEffect.DEXTERITY, 2);
        resolver.resolve(List.of(Effect.of(EffectType.BLOCK, 5)), cardContext(null));
        assertEquals(7, player.getBlock());
        assertEquals(1, state.getEvents().count(LifecycleEvent.BLOCK_GAINED));
    }

    @Test
    void testDebuffsLandOnTheTarget() throws CatalogException {
        resolver.resolve(List.of(Effect.of(EffectType.APPLY_VULNERABLE, 2), Effect.of(EffectType.APPLY_WEAK, 1)),
                cardContext(first));
        assertEquals(2, first.getStatus(StatusEffect.VULNERABLE));
        assertEquals(1, first.getStatus(StatusEffect.WEAK));
        assertEquals(0, second.getStatus(StatusEffect.VULNERABLE));
        assertEquals(2, state.getEvents().count(LifecycleEvent.DEBUFF_APPLIED));
    }

    @Test
    void testArtifactBlocksEnemyDebuff() {
        player.applyStatus(StatusEffect.ARTIFACT, 1);
        EffectContext ctx = EffectContext.forEnemy(state, first);

        resolver.resolve(List.of(Effect.of(EffectType.APPLY_FRAIL, 2), Effect.of(EffectType.APPLY_WEAK, 2)), ctx);

        assertEquals(0, player.getStatus(StatusEffect.ARTIFACT));
        assertEquals(0, player.getStatus(StatusEffect.FRAIL));
        assertEquals(2, player.getStatus(StatusEffect.WEAK));
        assertEquals(1, state.getEvents().count(LifecycleEvent.DEBUFF_PREVENTED));
    }

    @Test
    void testReduceStrengthNeverRaisesIt() throws CatalogException {
        first.applyStatus(StatusEffect.STRENGTH, 3);
        resolver.resolve(List.of(Effect.of(EffectType.REDUCE_STRENGTH, 5)), cardContext(first));
        assertEquals(0, first.getStatus(StatusEffect.STRENGTH));
    }

    @Test
    void testEnemyTargeting() {
        EffectContext ctx = EffectContext.forEnemy(state, first);
        List<Combatant> self = resolver.resolveTargets(Effect.of(EffectType.BLOCK, 5, TargetType.SELF), ctx);
        List<Combatant> attack = resolver.resolveTargets(Effect.of(EffectType.DAMAGE, 5), ctx);
        List<Combatant> all = resolver.resolveTargets(Effect.of(EffectType.APPLY_WEAK, 1, TargetType.ALL_ENEMIES), ctx);

        assertEquals(List.of(first), self);
        assertEquals(List.of(player), attack);
        assertEquals(List.of(player), all);
    }

    @Test
    void testEnemyCannotUsePlayerOnlyEffects() {
        EffectResult result = resolver.resolveEffect(Effect.of(EffectType.DRAW, 2), EffectContext.forEnemy(state, first));
        assertFalse(result.success());
        assertTrue(result.shouldContinue());
    }

    @Test
    void testEnemyAttackPlayer() {
        first.applyStatus(StatusEffect.STRENGTH, 2);
        player.gainBlock(3);
        resolver.resolve(List.of(Effect.of(EffectType.DAMAGE, 5)), EffectContext.forEnemy(state, first));
        assertEquals(46, player.getCurrentHp());
        assertEquals(1, state.getEvents().count(LifecycleEvent.PLAYER_DAMAGED));
    }

    @Test
    void testAddCardsAndUnknownIds() throws CatalogException {
        List<EffectResult> results = resolver.resolve(List.of(
                Effect.withCard(EffectType.ADD_TO_HAND, 2, "rubble"),
                Effect.withCard(EffectType.ADD_TO_DISCARD, 1, "no_such_card"),
                Effect.withCard(EffectType.ADD_TO_DRAW, 1, "rubble")), cardContext(null));

        assertEquals(3, results.size());
        assertFalse(results.get(1).success());
        assertEquals(2, state.getHand().size());
        assertEquals(0, state.getDiscardPile().size());
        assertEquals(1, state.getDrawPile().size());
        assertNotSame(state.getHand().get(0), state.getHand().get(1));
    }

    @Test
    void testAddToFullHandOverflowsToDiscard() throws CatalogException {
        for (int i = 0; i < 10; i++) {
            state.getHand().add(catalog.createCard("strike"));
        }
        resolver.resolve(List.of(Effect.withCard(EffectType.ADD_TO_HAND, 1, "rubble")), cardContext(null));
        assertEquals(10, state.getHand().size());
        assertEquals(1, state.getDiscardPile().size());
    }

    @Test
    void testDuplicateSourceCard() throws CatalogException {
        Card source = catalog.createCard("strike").upgraded();
        EffectContext ctx = EffectContext.forCard(state, source, null, 1);
        resolver.resolve(List.of(Effect.of(EffectType.DUPLICATE_CARD, 1)), ctx);

        Card copy = state.getDiscardPile().getCards().get(0);
        assertNotSame(source, copy);
        assertTrue(copy.isUpgraded());
    }

    @Test
    void testScryDiscardsJunkOnly() throws CatalogException {
        state.getDrawPile().putOnTop(catalog.createCard("strike"));
        state.getDrawPile().putOnTop(catalog.createCard("rubble"));
        state.getDrawPile().putOnTop(catalog.createCard("strike"));
        state.getDrawPile().putOnTop(catalog.createCard("rubble"));

        EffectResult result = resolver.resolveEffect(Effect.of(EffectType.SCRY, 3), cardContext(null));

        assertEquals(2, result.value());
        assertEquals(2, state.getDrawPile().size());
        assertEquals("Strike", state.getDrawPile().peekTop().orElseThrow().getName());
        assertEquals(2, state.getDiscardPile().size());
        assertTrue(state.getEvents().getEvents().stream()
                .filter(e -> e.type() == LifecycleEvent.CARD_DISCARDED)
                .allMatch(e -> "Rubble".equals(e.targetId())));
    }

    @Test
    void testUpgradeWholeHand() throws CatalogException {
        state.getHand().add(catalog.createCard("strike"));
        state.getHand().add(catalog.createCard("strike"));
        state.getHand().add(catalog.createCard("rubble"));

        EffectResult result = resolver.resolveEffect(Effect.of(EffectType.UPGRADE_CARD, 0), cardContext(null));

        assertEquals(2, result.value());
        assertEquals("Strike+", state.getHand().get(0).getName());
        assertEquals("Strike+", state.getHand().get(1).getName());
        assertEquals("Rubble", state.getHand().get(2).getName());
    }

    @Test
    void testTransformDrawsFromDraftablePool() throws CatalogException {
        state.getHand().add(catalog.createCard("rubble"));
        resolver.resolveEffect(Effect.of(EffectType.TRANSFORM_CARD, 1), cardContext(null));
        assertEquals("cleave", state.getHand().get(0).getId());
    }

    @Test
    void testNothingResolvesAfterCombatEnds() throws CatalogException {
        state.setPhase(CombatPhase.VICTORY);
        List<EffectResult> results = resolver.resolve(List.of(Effect.of(EffectType.BLOCK, 5)), cardContext(null));
        assertTrue(results.isEmpty());
        assertEquals(0, player.getBlock());
    }
}
