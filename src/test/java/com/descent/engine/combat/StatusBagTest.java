package com.descent.engine.combat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatusBag stacking rules.
 */
class StatusBagTest {

    @Test
    void testDurationStatusesTakeMax() {
        StatusBag bag = new StatusBag();
        bag.apply(StatusEffect.WEAK, 3);
        bag.apply(StatusEffect.WEAK, 2);
        assertEquals(3, bag.get(StatusEffect.WEAK));

        bag.apply(StatusEffect.VULNERABLE, 1);
        bag.apply(StatusEffect.VULNERABLE, 4);
        assertEquals(4, bag.get(StatusEffect.VULNERABLE));
    }

    @Test
    void testMagnitudeStatusesAdd() {
        StatusBag bag = new StatusBag();
        bag.apply(StatusEffect.POISON, 3);
        bag.apply(StatusEffect.POISON, 2);
        assertEquals(5, bag.get(StatusEffect.POISON));

        bag.apply(StatusEffect.STRENGTH, 2);
        bag.apply(StatusEffect.STRENGTH, -5);
        assertEquals(-3, bag.get(StatusEffect.STRENGTH), "Strength is signed");
    }

    @Test
    void testUnsignedStatusesFloorAtZero() {
        StatusBag bag = new StatusBag();
        bag.set(StatusEffect.THORNS, -2);
        assertEquals(0, bag.get(StatusEffect.THORNS));
        assertFalse(bag.has(StatusEffect.THORNS));
    }

    @Test
    void testDecrement() {
        StatusBag bag = new StatusBag();
        bag.apply(StatusEffect.FRAIL, 1);
        bag.decrement(StatusEffect.FRAIL);
        bag.decrement(StatusEffect.FRAIL);
        assertEquals(0, bag.get(StatusEffect.FRAIL));
        assertTrue(bag.snapshot().isEmpty());
    }

    @Test
    void testSnapshotIsUnmodifiable() {
        StatusBag bag = new StatusBag();
        bag.apply(StatusEffect.ARTIFACT, 1);
        assertThrows(UnsupportedOperationException.class,
                () -> bag.snapshot().put(StatusEffect.ARTIFACT, 5));
    }

    @Test
    void testStatusKeysParse() {
        assertEquals(StatusEffect.PLATED_ARMOR, StatusEffect.fromString("plated_armor"));
        assertEquals(StatusEffect.PLATED_ARMOR, StatusEffect.fromString("platedArmor"));
        assertEquals("plated_armor", StatusEffect.PLATED_ARMOR.getJsonValue());
        assertThrows(IllegalArgumentException.class, () -> StatusEffect.fromString("confused"));
    }
}
