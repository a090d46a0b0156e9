package com.descent.engine.catalog;

import com.descent.engine.card.Card;
import com.descent.engine.card.CardTemplate;
import com.descent.engine.combat.CombatConstants;
import com.descent.engine.enemy.Enemy;
import com.descent.engine.enemy.EnemyTemplate;
import com.descent.engine.potion.Potion;
import com.descent.engine.relic.Relic;
import com.descent.engine.relic.RelicTemplate;
import com.descent.engine.rng.RandomSource;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Registry of card, enemy, relic and potion templates keyed by id.
 * Built once and passed to the engine; also hands out runtime instances.
 */
public class Catalog {
    private static final Logger logger = LogManager.getLogger(Catalog.class.getName());

    public static final String CARDS_FILE = "cards.json";
    public static final String ENEMIES_FILE = "enemies.json";
    public static final String RELICS_FILE = "relics.json";
    public static final String POTIONS_FILE = "potions.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Map<String, CardTemplate> cards;
    private final Map<String, EnemyTemplate> enemies;
    private final Map<String, RelicTemplate> relics;
    private final Map<String, Potion> potions;

    private final AtomicLong nextCardInstance = new AtomicLong(1);
    private final AtomicLong nextEnemyInstance = new AtomicLong(1);

    private Catalog(Map<String, CardTemplate> cards, Map<String, EnemyTemplate> enemies,
                    Map<String, RelicTemplate> relics, Map<String, Potion> potions) {
        this.cards = cards;
        this.enemies = enemies;
        this.relics = relics;
        this.potions = potions;
    }

    // ---- Loading ----

    /**
     * Load the four catalog files from a classpath directory, e.g. "catalog".
     * Missing files load as empty.
     */
    public static Catalog fromResources(String directory) throws CatalogException {
        String prefix = directory.isEmpty() || directory.endsWith("/") ? directory : directory + "/";
        return fromJson(
                readResource(prefix + CARDS_FILE),
                readResource(prefix + ENEMIES_FILE),
                readResource(prefix + RELICS_FILE),
                readResource(prefix + POTIONS_FILE));
    }

    /**
     * Load the four catalog files from a directory on disk.
     * Missing files load as empty.
     */
    public static Catalog fromDirectory(Path directory) throws CatalogException {
        return fromJson(
                readFile(directory.resolve(CARDS_FILE)),
                readFile(directory.resolve(ENEMIES_FILE)),
                readFile(directory.resolve(RELICS_FILE)),
                readFile(directory.resolve(POTIONS_FILE)));
    }

    /**
     * Load from JSON array strings. Null or blank strings count as empty arrays.
     */
    public static Catalog fromJson(String cardsJson, String enemiesJson, String relicsJson, String potionsJson)
            throws CatalogException {
        Builder builder = builder();
        parse(cardsJson, new TypeReference<List<CardTemplate>>() {}, CARDS_FILE).forEach(builder::card);
        parse(enemiesJson, new TypeReference<List<EnemyTemplate>>() {}, ENEMIES_FILE).forEach(builder::enemy);
        parse(relicsJson, new TypeReference<List<RelicTemplate>>() {}, RELICS_FILE).forEach(builder::relic);
        parse(potionsJson, new TypeReference<List<Potion>>() {}, POTIONS_FILE).forEach(builder::potion);
        return builder.build();
    }

    private static <T> List<T> parse(String json, TypeReference<List<T>> type, String source) throws CatalogException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<T> parsed = MAPPER.readValue(json, type);
            return parsed == null ? List.of() : parsed;
        } catch (IOException e) {
            throw new CatalogException("JSON parsing error in " + source + ": " + e.getMessage(), e);
        }
    }

    private static String readResource(String resourcePath) throws CatalogException {
        try (InputStream is = Catalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.debug("Catalog resource not found: {}", resourcePath);
                return null;
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CatalogException("IO error reading " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    private static String readFile(Path path) throws CatalogException {
        if (!Files.exists(path)) {
            logger.debug("Catalog file not found: {}", path);
            return null;
        }
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new CatalogException("IO error: " + e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---- Cards ----

    /**
     * @throws CatalogException if the card is not found
     */
    public CardTemplate getCard(String id) throws CatalogException {
        CardTemplate card = cards.get(id);
        if (card == null) {
            throw new CatalogException("Card not found: " + id);
        }
        return card;
    }

    public Optional<CardTemplate> findCard(String id) {
        return Optional.ofNullable(id == null ? null : cards.get(id));
    }

    public boolean hasCard(String id) {
        return cards.containsKey(id);
    }

    public int cardCount() {
        return cards.size();
    }

    public Collection<CardTemplate> getCards() {
        return Collections.unmodifiableCollection(cards.values());
    }

    /**
     * New runtime copy of a template with a fresh instance id.
     */
    public Card newCard(CardTemplate template) {
        return new Card(template, nextCardInstance.getAndIncrement());
    }

    /**
     * New runtime card by id.
     * @throws CatalogException if the card is not found
     */
    public Card createCard(String id) throws CatalogException {
        return newCard(getCard(id));
    }

    /**
     * New runtime card by id, or empty (and a warning) for an unknown id.
     */
    public Optional<Card> tryCreateCard(String id) {
        Optional<CardTemplate> template = findCard(id);
        if (template.isEmpty()) {
            logger.warn("Unknown card id '{}'", id);
        }
        return template.map(this::newCard);
    }

    // ---- Enemies ----

    /**
     * @throws CatalogException if the enemy is not found
     */
    public EnemyTemplate getEnemy(String id) throws CatalogException {
        EnemyTemplate enemy = enemies.get(id);
        if (enemy == null) {
            throw new CatalogException("Enemy not found: " + id);
        }
        return enemy;
    }

    public boolean hasEnemy(String id) {
        return enemies.containsKey(id);
    }

    public int enemyCount() {
        return enemies.size();
    }

    public Collection<EnemyTemplate> getEnemies() {
        return Collections.unmodifiableCollection(enemies.values());
    }

    /**
     * Instantiate an enemy with max HP rolled within +/-10% of the template value.
     * @throws CatalogException if the enemy is not found
     */
    public Enemy createEnemy(String id, RandomSource rng) throws CatalogException {
        EnemyTemplate template = getEnemy(id);
        int minHp = (int) Math.floor(template.getMaxHp() * (1 - CombatConstants.ENEMY_HP_VARIANCE));
        int maxHp = (int) Math.floor(template.getMaxHp() * (1 + CombatConstants.ENEMY_HP_VARIANCE));
        int hp = Math.max(1, minHp + rng.nextInt(maxHp - minHp + 1));
        return new Enemy(id + "#" + nextEnemyInstance.getAndIncrement(), template, hp);
    }

    /**
     * Instantiate an enemy at exactly its template HP.
     * @throws CatalogException if the enemy is not found
     */
    public Enemy createEnemyExact(String id) throws CatalogException {
        EnemyTemplate template = getEnemy(id);
        return new Enemy(id + "#" + nextEnemyInstance.getAndIncrement(), template, template.getMaxHp());
    }

    // ---- Relics ----

    /**
     * @throws CatalogException if the relic is not found
     */
    public RelicTemplate getRelic(String id) throws CatalogException {
        RelicTemplate relic = relics.get(id);
        if (relic == null) {
            throw new CatalogException("Relic not found: " + id);
        }
        return relic;
    }

    public boolean hasRelic(String id) {
        return relics.containsKey(id);
    }

    public int relicCount() {
        return relics.size();
    }

    public Collection<RelicTemplate> getRelics() {
        return Collections.unmodifiableCollection(relics.values());
    }

    /**
     * @throws CatalogException if the relic is not found
     */
    public Relic createRelic(String id) throws CatalogException {
        return new Relic(getRelic(id));
    }

    // ---- Potions ----

    /**
     * @throws CatalogException if the potion is not found
     */
    public Potion getPotion(String id) throws CatalogException {
        Potion potion = potions.get(id);
        if (potion == null) {
            throw new CatalogException("Potion not found: " + id);
        }
        return potion;
    }

    public boolean hasPotion(String id) {
        return potions.containsKey(id);
    }

    public int potionCount() {
        return potions.size();
    }

    public Collection<Potion> getPotions() {
        return Collections.unmodifiableCollection(potions.values());
    }

    /**
     * Collects templates, rejecting blank and duplicate ids.
     */
    public static class Builder {
        private final List<CardTemplate> cards = new ArrayList<>();
        private final List<EnemyTemplate> enemies = new ArrayList<>();
        private final List<RelicTemplate> relics = new ArrayList<>();
        private final List<Potion> potions = new ArrayList<>();

        public Builder card(CardTemplate card) {
            cards.add(card);
            return this;
        }

        public Builder enemy(EnemyTemplate enemy) {
            enemies.add(enemy);
            return this;
        }

        public Builder relic(RelicTemplate relic) {
            relics.add(relic);
            return this;
        }

        public Builder potion(Potion potion) {
            potions.add(potion);
            return this;
        }

        public Catalog build() throws CatalogException {
            return new Catalog(
                    index(cards, CardTemplate::getId, "card"),
                    index(enemies, EnemyTemplate::getId, "enemy"),
                    index(relics, RelicTemplate::getId, "relic"),
                    index(potions, Potion::getId, "potion"));
        }

        private static <T> Map<String, T> index(List<T> items, Function<T, String> idOf, String kind)
                throws CatalogException {
            Map<String, T> byId = new LinkedHashMap<>();
            for (T item : items) {
                String id = idOf.apply(item);
                if (id == null || id.isBlank()) {
                    throw new CatalogException("A " + kind + " is missing its id");
                }
                if (byId.put(id, item) != null) {
                    throw new CatalogException("Duplicate " + kind + " id: " + id);
                }
            }
            return byId;
        }
    }
}
