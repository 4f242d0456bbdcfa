package com.p14n.pollevent.simulator;

import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.p14n.pollevent.data.ControlReading;
import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.data.ControlValue;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedControlPortTest {

    private static final ControlReference GAIN = ControlReference.parse("Mixer.gain");
    private static final ControlReference MUTE = ControlReference.parse("Mixer.mute");
    private static final ControlReference LEVEL = ControlReference.parse("Mixer.level");
    private static final ControlReference INPUT = ControlReference.parse("Router.input");
    private static final ControlReference OTHER = ControlReference.parse("knob");

    @Test
    void testValuesFollowControlNames() throws Exception {
        SimulatedControlPort port = new SimulatedControlPort(new Random(42), 1.0);
        for (int i = 0; i < 50; i++) {
            Map<ControlReference, ControlReading> r = port.read(List.of(GAIN, MUTE, LEVEL, INPUT, OTHER));

            double gain = r.get(GAIN).value().asNumber();
            assertTrue(gain >= -15 && gain <= 15);
            assertTrue(r.get(GAIN).stringValue().endsWith(" dB"));

            String mute = r.get(MUTE).stringValue();
            assertEquals(r.get(MUTE).value().asBoolean() ? "muted" : "unmuted", mute);

            double level = r.get(LEVEL).value().asNumber();
            assertTrue(level >= 0 && level <= 100);
            assertTrue(r.get(LEVEL).stringValue().endsWith("%"));

            double input = r.get(INPUT).value().asNumber();
            assertTrue(input >= 1 && input <= 8);
            assertTrue(r.get(INPUT).stringValue().startsWith("Input "));

            double other = r.get(OTHER).value().asNumber();
            assertTrue(other >= 0 && other <= 1);
            assertNull(r.get(OTHER).stringValue());
        }
    }

    @Test
    void testZeroProbabilityNeverChanges() throws Exception {
        SimulatedControlPort port = new SimulatedControlPort(new Random(1), 0);
        ControlValue first = port.read(List.of(LEVEL)).get(LEVEL).value();
        for (int i = 0; i < 20; i++) {
            assertEquals(first, port.read(List.of(LEVEL)).get(LEVEL).value());
        }
    }

    @Test
    void testMuteTogglesOnEveryChange() throws Exception {
        SimulatedControlPort port = new SimulatedControlPort(new Random(7), 1.0);
        boolean previous = port.read(List.of(MUTE)).get(MUTE).value().asBoolean();
        for (int i = 0; i < 5; i++) {
            boolean next = port.read(List.of(MUTE)).get(MUTE).value().asBoolean();
            assertNotEquals(previous, next);
            previous = next;
        }
    }

    @Test
    void testRejectsInvalidProbability() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatedControlPort(new Random(), 1.5));
        assertThrows(IllegalArgumentException.class, () -> new SimulatedControlPort(new Random(), -0.1));
    }
}
