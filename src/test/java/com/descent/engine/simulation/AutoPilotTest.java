package com.descent.engine.simulation;

import com.descent.engine.card.CardTemplate;
import com.descent.engine.card.CardType;
import com.descent.engine.card.Effect;
import com.descent.engine.card.EffectType;
import com.descent.engine.card.TargetType;
import com.descent.engine.catalog.Catalog;
import com.descent.engine.catalog.CatalogException;
import com.descent.engine.combat.Player;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.enemy.EnemyMove;
import com.descent.engine.enemy.EnemyTemplate;
import com.descent.engine.enemy.EnemyType;
import com.descent.engine.enemy.Intent;
import com.descent.engine.game.CombatEngine;
import com.descent.engine.potion.Potion;
import com.descent.engine.rng.GameRng;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AutoPilotTest {

    private Catalog catalog;

    @BeforeEach
    void setUp() throws CatalogException {
        catalog = Catalog.builder()
                .card(new CardTemplate("strike", "Strike", CardType.ATTACK, 1, TargetType.SINGLE_ENEMY,
                        List.of(Effect.of(EffectType.DAMAGE, 6))))
                .card(new CardTemplate("heavy", "Heavy", CardType.ATTACK, 2, TargetType.SINGLE_ENEMY,
                        List.of(Effect.of(EffectType.DAMAGE, 14))))
                .card(new CardTemplate("rubble", "Rubble", CardType.STATUS, -1, TargetType.SELF, List.of()))
                .enemy(new EnemyTemplate("dummy", "Dummy", EnemyType.NORMAL, 30,
                        List.of(new EnemyMove("Poke", Intent.attack(5), 1, List.of(Effect.of(EffectType.DAMAGE, 5))))))
                .build();
    }

    private CombatEngine start(Player player, String... cardIds) throws CatalogException {
        for (String id : cardIds) {
            player.addCardToDeck(catalog.createCard(id));
        }
        CombatEngine engine = new CombatEngine(catalog, new GameRng(5), player);
        Enemy healthy = new Enemy("dummy#1", catalog.getEnemy("dummy"), 30);
        Enemy hurt = new Enemy("dummy#2", catalog.getEnemy("dummy"), 30);
        hurt.loseHp(20);
        engine.startCombat(List.of(healthy, hurt));
        return engine;
    }

    @Test
    void testTargetsWeakestEnemy() throws CatalogException {
        CombatEngine engine = start(new Player("Tester", 50), "strike", "strike", "strike", "strike", "strike");
        assertEquals(1, AutoPilot.chooseTarget(engine.getState()).orElseThrow());
    }

    @Test
    void testPrefersMostExpensiveAffordableCard() throws CatalogException {
        CombatEngine engine = start(new Player("Tester", 50), "strike", "strike", "heavy", "rubble", "strike");

        Optional<AutoPilot.Play> play = AutoPilot.chooseCard(engine);

        assertTrue(play.isPresent());
        assertEquals("heavy", engine.getState().getHand().get(play.get().handIndex()).getId());
        assertEquals(1, play.get().targetIndex());
    }

    @Test
    void testNothingToPlay() throws CatalogException {
        CombatEngine engine = start(new Player("Tester", 50), "rubble", "rubble", "rubble");
        assertTrue(AutoPilot.chooseCard(engine).isEmpty());
    }

    @Test
    void testPotionOnlyWhenHurt() throws CatalogException {
        Player player = new Player("Tester", 50);
        player.addPotion(new Potion("healing_draught", "Healing Draught", TargetType.SELF,
                List.of(Effect.of(EffectType.HEAL, 15))));
        CombatEngine engine = start(player, "strike", "strike", "strike");

        assertTrue(AutoPilot.choosePotion(engine.getState()).isEmpty());
        player.loseHp(30);
        assertEquals(0, AutoPilot.choosePotion(engine.getState()).getAsInt());
    }
}
