package com.p14n.pollevent.simulator;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import com.p14n.pollevent.data.ControlReading;
import com.p14n.pollevent.data.ControlReference;
import com.p14n.pollevent.remote.RemoteControlPort;

/**
 * Stand-in for a real device. Produces plausible values by control name and
 * changes each control with a fixed probability per read:
 *
 * <ul>
 * <li>gain: -15..15 dB random walk</li>
 * <li>mute: toggles</li>
 * <li>level, volume: 0..100</li>
 * <li>select, input: 1..8</li>
 * <li>anything else: 0..1</li>
 * </ul>
 */
public class SimulatedControlPort implements RemoteControlPort {

    private final Random random;
    private final double changeProbability;
    private final Map<ControlReference, Object> values = new HashMap<>();

    public SimulatedControlPort() {
        this(new Random(), 0.3);
    }

    public SimulatedControlPort(Random random, double changeProbability) {
        if (changeProbability < 0 || changeProbability > 1) {
            throw new IllegalArgumentException("changeProbability must be between 0 and 1");
        }
        this.random = random;
        this.changeProbability = changeProbability;
    }

    @Override
    public synchronized Map<ControlReference, ControlReading> read(List<ControlReference> controls) {
        Map<ControlReference, ControlReading> readings = new HashMap<>();
        for (ControlReference ref : controls) {
            Object current = values.get(ref);
            if (current == null) {
                current = initial(ref);
            } else if (random.nextDouble() < changeProbability) {
                current = next(ref, current);
            }
            values.put(ref, current);
            readings.put(ref, ControlReading.of(current, describe(ref, current)));
        }
        return readings;
    }

    private Object initial(ControlReference ref) {
        return switch (type(ref)) {
            case GAIN -> round(random.nextDouble() * 30 - 15);
            case MUTE -> random.nextBoolean();
            case LEVEL -> (double) random.nextInt(101);
            case SELECT -> (double) (1 + random.nextInt(8));
            case OTHER -> round(random.nextDouble());
        };
    }

    private Object next(ControlReference ref, Object current) {
        return switch (type(ref)) {
            case GAIN -> round(Math.max(-15, Math.min(15, (Double) current + random.nextGaussian())));
            case MUTE -> !(Boolean) current;
            case LEVEL -> (double) random.nextInt(101);
            case SELECT -> (double) (1 + random.nextInt(8));
            case OTHER -> round(random.nextDouble());
        };
    }

    private static String describe(ControlReference ref, Object value) {
        return switch (type(ref)) {
            case GAIN -> String.format(Locale.ROOT, "%.1f dB", (Double) value);
            case MUTE -> (Boolean) value ? "muted" : "unmuted";
            case LEVEL -> String.format(Locale.ROOT, "%.0f%%", (Double) value);
            case SELECT -> String.format(Locale.ROOT, "Input %.0f", (Double) value);
            case OTHER -> null;
        };
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private enum Type {
        GAIN, MUTE, LEVEL, SELECT, OTHER
    }

    private static Type type(ControlReference ref) {
        String name = ref.control().toLowerCase(Locale.ROOT);
        if (name.contains("gain")) {
            return Type.GAIN;
        }
        if (name.contains("mute")) {
            return Type.MUTE;
        }
        if (name.contains("level") || name.contains("volume")) {
            return Type.LEVEL;
        }
        if (name.contains("select") || name.contains("input")) {
            return Type.SELECT;
        }
        return Type.OTHER;
    }
}
