package com.descent.engine.catalog;

import com.descent.engine.card.Card;
import com.descent.engine.card.CardTemplate;
import com.descent.engine.card.CardType;
import com.descent.engine.card.EffectType;
import com.descent.engine.card.Rarity;
import com.descent.engine.card.TargetType;
import com.descent.engine.combat.StatusEffect;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.enemy.EnemyTemplate;
import com.descent.engine.enemy.EnemyType;
import com.descent.engine.enemy.IntentType;
import com.descent.engine.game.LifecycleEvent;
import com.descent.engine.potion.Potion;
import com.descent.engine.relic.CounterReset;
import com.descent.engine.relic.RelicAction;
import com.descent.engine.relic.RelicEffect;
import com.descent.engine.relic.RelicTemplate;
import com.descent.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Catalog loading and lookups.
 */
class CatalogTest {

    private static Catalog catalog;

    @BeforeAll
    static void loadCatalog() throws CatalogException {
        catalog = Catalog.fromResources("catalog");
    }

    @Test
    void testLoadBundledCatalog() {
        assertTrue(catalog.cardCount() > 0, "Should have loaded cards");
        assertTrue(catalog.enemyCount() > 0, "Should have loaded enemies");
        assertTrue(catalog.relicCount() > 0, "Should have loaded relics");
        assertTrue(catalog.potionCount() > 0, "Should have loaded potions");
    }

    @Test
    void testCardFields() throws CatalogException {
        CardTemplate bash = catalog.getCard("bash");
        assertEquals("Bash", bash.getName());
        assertEquals(CardType.ATTACK, bash.getType());
        assertEquals(Rarity.STARTER, bash.getRarity());
        assertEquals(2, bash.getCost());
        assertEquals(TargetType.SINGLE_ENEMY, bash.getTargetType());
        assertEquals(EffectType.APPLY_VULNERABLE, bash.getEffects().get(1).type());
        assertTrue(bash.canUpgrade());

        Card upgraded = catalog.createCard("bash").upgraded();
        assertEquals("Bash+", upgraded.getName());
        assertEquals(10, upgraded.effectValue(EffectType.DAMAGE));
    }

    @Test
    void testKeywordsAndXCost() throws CatalogException {
        assertTrue(catalog.getCard("avalanche").isXCost());
        assertTrue(catalog.getCard("brace").isRetain());
        assertTrue(catalog.getCard("flare").isInnate());
        assertTrue(catalog.getCard("delve").isExhaust());
        assertTrue(catalog.getCard("dim_memory").isEthereal());
        assertFalse(catalog.createCard("dim_memory").upgraded().isEthereal());
        assertFalse(catalog.createCard("rubble").isPlayable());
        assertEquals("rubble", catalog.getCard("cave_in").getEffects().get(1).cardId());
        assertEquals(2, catalog.getCard("pickaxe_swing").getEffects().get(0).times());
    }

    @Test
    void testEnemyFields() throws CatalogException {
        EnemyTemplate golem = catalog.getEnemy("stone_golem");
        assertEquals(EnemyType.ELITE, golem.getType());
        assertEquals(70, golem.getMaxHp());
        assertEquals(6, golem.getStartingStatus().get(StatusEffect.PLATED_ARMOR));
        assertEquals(3, golem.getMoves().get(1).getIntent().times());
        assertEquals(IntentType.DEFEND, golem.getMoves().get(2).getIntent().type());
        assertTrue(golem.isAntiRepeat());
        assertFalse(catalog.getEnemy("deep_warden").isAntiRepeat());
    }

    @Test
    void testRelicTriggersAreNormalized() throws CatalogException {
        RelicEffect anchor = catalog.getRelic("iron_anchor").getEffects().get(0);
        assertEquals("COMBAT_START", anchor.getTrigger());

        RelicTemplate drum = catalog.getRelic("war_drum");
        assertEquals("ATTACK_PLAYED", drum.getEffects().get(0).getTrigger());
        assertEquals(CounterReset.TURN, drum.getCounterReset());

        RelicTemplate shell = catalog.getRelic("calcified_shell");
        assertEquals(Rarity.SPECIAL, shell.getRarity());
        assertEquals(RelicAction.RETAIN_BLOCK, shell.getEffects().get(0).actionKind().orElseThrow());

        RelicEffect tome = catalog.getRelic("dusty_tome").getEffects().get(0);
        assertTrue(tome.firesOn(LifecycleEvent.CARD_DRAWN));
        assertEquals(1, tome.getPayload());
    }

    @Test
    void testPotionFields() throws CatalogException {
        Potion blast = catalog.getPotion("blast_flask");
        assertTrue(blast.requiresTarget());
        assertFalse(catalog.getPotion("healing_draught").requiresTarget());
    }

    @Test
    void testEnemyHpVariance() throws CatalogException {
        GameRng rng = new GameRng(17);
        for (int i = 0; i < 200; i++) {
            Enemy crawler = catalog.createEnemy("cave_crawler", rng);
            // 42 +/- 10%, floored
            assertTrue(crawler.getMaxHp() >= 37 && crawler.getMaxHp() <= 46,
                    "HP out of range: " + crawler.getMaxHp());
            assertEquals(crawler.getMaxHp(), crawler.getCurrentHp());
        }
        assertEquals(42, catalog.createEnemyExact("cave_crawler").getMaxHp());
    }

    @Test
    void testEnemyInstanceIdsAreUnique() throws CatalogException {
        Enemy a = catalog.createEnemyExact("ooze");
        Enemy b = catalog.createEnemyExact("ooze");
        assertNotEquals(a.getId(), b.getId());
        assertTrue(a.getId().startsWith("ooze#"));
    }

    @Test
    void testCardInstancesAreFresh() throws CatalogException {
        Card a = catalog.createCard("strike");
        Card b = catalog.createCard("strike");
        assertNotEquals(a.getInstanceId(), b.getInstanceId());
    }

    @Test
    void testUnknownIds() {
        assertThrows(CatalogException.class, () -> catalog.getCard("nonexistent"));
        assertThrows(CatalogException.class, () -> catalog.createEnemy("nonexistent", new GameRng(1)));
        assertThrows(CatalogException.class, () -> catalog.getRelic("nonexistent"));
        assertThrows(CatalogException.class, () -> catalog.getPotion("nonexistent"));
        assertTrue(catalog.tryCreateCard("nonexistent").isEmpty());
        assertTrue(catalog.findCard(null).isEmpty());
    }

    @Test
    void testMalformedJsonFails() {
        CatalogException e = assertThrows(CatalogException.class,
                () -> Catalog.fromJson("[{\"id\": \"x\", ", null, null, null));
        assertTrue(e.getMessage().contains("cards.json"));
    }

    @Test
    void testUnknownEffectTypeFails() {
        String cards = "[{\"id\": \"x\", \"name\": \"X\", \"type\": \"SKILL\", \"cost\": 1,"
                + " \"effects\": [{\"type\": \"EXPLODE\", \"value\": 1}]}]";
        assertThrows(CatalogException.class, () -> Catalog.fromJson(cards, null, null, null));
    }

    @Test
    void testUnknownFieldsAreIgnored() throws CatalogException {
        String cards = "[{\"id\": \"x\", \"name\": \"X\", \"type\": \"SKILL\", \"cost\": 1, \"art\": \"x.png\"}]";
        Catalog small = Catalog.fromJson(cards, "", null, "[]");
        assertEquals(1, small.cardCount());
        assertEquals(0, small.enemyCount());
        assertEquals(TargetType.SELF, small.getCard("x").getTargetType());
    }

    @Test
    void testDuplicateIdsRejected() {
        String cards = "[{\"id\": \"x\", \"name\": \"X\", \"type\": \"SKILL\", \"cost\": 1},"
                + " {\"id\": \"x\", \"name\": \"Y\", \"type\": \"SKILL\", \"cost\": 0}]";
        CatalogException e = assertThrows(CatalogException.class, () -> Catalog.fromJson(cards, null, null, null));
        assertTrue(e.getMessage().contains("Duplicate"));
    }

    @Test
    void testEveryBundledCardReferenceResolves() {
        for (CardTemplate card : catalog.getCards()) {
            card.getEffects().stream()
                    .filter(effect -> effect.cardId() != null)
                    .forEach(effect -> assertTrue(catalog.hasCard(effect.cardId()),
                            card.getId() + " references " + effect.cardId()));
        }
        for (EnemyTemplate enemy : catalog.getEnemies()) {
            enemy.getMoves().forEach(move -> move.getActions().stream()
                    .filter(effect -> effect.cardId() != null)
                    .forEach(effect -> assertTrue(catalog.hasCard(effect.cardId()))));
        }
    }

    @Test
    void testEveryBundledRelicUsesKnownVocabulary() {
        for (RelicTemplate relic : catalog.getRelics()) {
            for (RelicEffect effect : relic.getEffects()) {
                assertTrue(effect.triggerEvent().isPresent(), relic.getId() + " trigger " + effect.getTrigger());
                assertTrue(effect.actionKind().isPresent(), relic.getId() + " action " + effect.getAction());
            }
        }
    }

    @Test
    void testDirectoryLoadingOfMissingDirectoryIsEmpty() throws CatalogException {
        Catalog empty = Catalog.fromDirectory(Path.of("does-not-exist"));
        assertEquals(0, empty.cardCount());
        assertEquals(List.of(), List.copyOf(empty.getPotions()));
    }
}
