package com.p14n.pollevent.data;

import java.util.Objects;

/**
 * Normalized value of a remote control.
 * Raw values are converted once, on ingestion, into one of three kinds so the
 * rest of the pipeline never deals with untyped values.
 */
public final class ControlValue {

    public enum Kind {
        NUMBER,
        STRING,
        BOOLEAN
    }

    private final Kind kind;
    private final double number;
    private final String text;
    private final boolean bool;

    private ControlValue(Kind kind, double number, String text, boolean bool) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.bool = bool;
    }

    public static ControlValue ofNumber(double number) {
        if (!Double.isFinite(number)) {
            throw new IllegalArgumentException("Numeric control value must be finite: " + number);
        }
        return new ControlValue(Kind.NUMBER, number, null, false);
    }

    public static ControlValue ofString(String text) {
        return new ControlValue(Kind.STRING, 0, Objects.requireNonNull(text, "text"), false);
    }

    public static ControlValue ofBoolean(boolean bool) {
        return new ControlValue(Kind.BOOLEAN, 0, null, bool);
    }

    /**
     * Normalizes a raw value as delivered by a remote control port.
     *
     * @param raw the raw value
     * @return the normalized value
     * @throws IllegalArgumentException for {@code null}, non-finite numbers and
     *                                  unsupported types
     */
    public static ControlValue of(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Control value cannot be null");
        }
        if (raw instanceof ControlValue v) {
            return v;
        }
        if (raw instanceof Boolean b) {
            return ofBoolean(b);
        }
        if (raw instanceof Number n) {
            return ofNumber(n.doubleValue());
        }
        if (raw instanceof CharSequence || raw instanceof Character) {
            return ofString(raw.toString());
        }
        throw new IllegalArgumentException("Unsupported control value type: " + raw.getClass().getName());
    }

    public Kind kind() {
        return kind;
    }

    public double asNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("Value is " + kind + ", not NUMBER");
        }
        return number;
    }

    public String asString() {
        if (kind != Kind.STRING) {
            throw new IllegalStateException("Value is " + kind + ", not STRING");
        }
        return text;
    }

    public boolean asBoolean() {
        if (kind != Kind.BOOLEAN) {
            throw new IllegalStateException("Value is " + kind + ", not BOOLEAN");
        }
        return bool;
    }

    /**
     * @return the payload as a plain Java object (Double, String or Boolean)
     */
    public Object raw() {
        return switch (kind) {
            case NUMBER -> number;
            case STRING -> text;
            case BOOLEAN -> bool;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ControlValue other) || other.kind != kind) {
            return false;
        }
        return switch (kind) {
            case NUMBER -> Double.compare(number, other.number) == 0;
            case STRING -> text.equals(other.text);
            case BOOLEAN -> bool == other.bool;
        };
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw());
    }

    @Override
    public String toString() {
        return kind + ":" + raw();
    }
}
