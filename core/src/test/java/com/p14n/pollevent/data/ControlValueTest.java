package com.p14n.pollevent.data;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControlValueTest {

    @Test
    void testNormalizesNumbers() {
        assertEquals(ControlValue.ofNumber(3.0), ControlValue.of(3));
        assertEquals(ControlValue.ofNumber(3.0), ControlValue.of(3L));
        assertEquals(ControlValue.ofNumber(0.5), ControlValue.of(0.5f));
        assertEquals(ControlValue.Kind.NUMBER, ControlValue.of(1).kind());
    }

    @Test
    void testNormalizesStringsAndBooleans() {
        assertEquals("Input 1", ControlValue.of("Input 1").asString());
        assertEquals("x", ControlValue.of('x').asString());
        assertTrue(ControlValue.of(true).asBoolean());
    }

    @Test
    void testRejectsUnsupportedValues() {
        assertThrows(IllegalArgumentException.class, () -> ControlValue.of(null));
        assertThrows(IllegalArgumentException.class, () -> ControlValue.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> ControlValue.of(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> ControlValue.of(new Object()));
    }

    @Test
    void testKindsAreNotInterchangeable() {
        assertNotEquals(ControlValue.of("1"), ControlValue.of(1));
        assertNotEquals(ControlValue.of(true), ControlValue.of(1));
        assertThrows(IllegalStateException.class, () -> ControlValue.of(1).asString());
    }

    @Test
    void testRawReturnsPlainJavaValue() {
        assertEquals(2.0, ControlValue.of(2).raw());
        assertEquals(Boolean.FALSE, ControlValue.of(false).raw());
        assertEquals("on", ControlValue.of("on").raw());
    }
}
