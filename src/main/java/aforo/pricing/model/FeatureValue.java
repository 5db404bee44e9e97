package aforo.pricing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Value of a feature, usage limit or expression result.
 * Serialized as the raw scalar (true, 10, "gold") so pricing documents stay readable;
 * the variant is recovered from the scalar's JSON/YAML type.
 */
public final class FeatureValue {

    public enum Type {
        BOOLEAN,
        NUMERIC,
        TEXT
    }

    public static final FeatureValue TRUE = new FeatureValue(Type.BOOLEAN, true, 0, null);
    public static final FeatureValue FALSE = new FeatureValue(Type.BOOLEAN, false, 0, null);
    public static final FeatureValue ZERO = new FeatureValue(Type.NUMERIC, false, 0, null);

    private final Type type;
    private final boolean booleanValue;
    private final double numericValue;
    private final String textValue;

    private FeatureValue(Type type, boolean booleanValue, double numericValue, String textValue) {
        this.type = type;
        this.booleanValue = booleanValue;
        this.numericValue = numericValue;
        this.textValue = textValue;
    }

    public static FeatureValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static FeatureValue of(double value) {
        // -0.0 is stored as 0.0 so that equal numbers are equal values
        return new FeatureValue(Type.NUMERIC, false, value == 0 ? 0.0 : value, null);
    }

    public static FeatureValue of(String value) {
        return new FeatureValue(Type.TEXT, false, 0, Objects.requireNonNull(value, "text value"));
    }

    /**
     * Builds a value from a raw scalar read from YAML/JSON. Returns null for null input.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FeatureValue fromRaw(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof FeatureValue value) {
            return value;
        }
        if (raw instanceof Boolean b) {
            return of(b);
        }
        if (raw instanceof Number n) {
            return of(n.doubleValue());
        }
        if (raw instanceof String s) {
            return of(s);
        }
        throw new IllegalArgumentException("Unsupported feature value: " + raw);
    }

    /**
     * Default "nothing configured" value for the given declared type.
     */
    public static FeatureValue emptyOf(Type type) {
        if (type == null) {
            return ZERO;
        }
        return switch (type) {
            case BOOLEAN -> FALSE;
            case NUMERIC -> ZERO;
            case TEXT -> of("");
        };
    }

    public Type getType() {
        return type;
    }

    public boolean isBoolean() {
        return type == Type.BOOLEAN;
    }

    public boolean isNumeric() {
        return type == Type.NUMERIC;
    }

    public boolean isText() {
        return type == Type.TEXT;
    }

    public boolean asBoolean() {
        if (type != Type.BOOLEAN) {
            throw new IllegalStateException("Not a boolean value: " + this);
        }
        return booleanValue;
    }

    public double asNumber() {
        if (type != Type.NUMERIC) {
            throw new IllegalStateException("Not a numeric value: " + this);
        }
        return numericValue;
    }

    public String asText() {
        if (type != Type.TEXT) {
            throw new IllegalStateException("Not a text value: " + this);
        }
        return textValue;
    }

    /**
     * Truthiness used by logical operators: booleans as they are, numbers when non-zero,
     * text when non-empty.
     */
    public boolean isTruthy() {
        return switch (type) {
            case BOOLEAN -> booleanValue;
            case NUMERIC -> numericValue != 0;
            case TEXT -> !textValue.isEmpty();
        };
    }

    @JsonValue
    public Object toRaw() {
        return switch (type) {
            case BOOLEAN -> booleanValue;
            case NUMERIC -> numericValue == Math.rint(numericValue) && !Double.isInfinite(numericValue)
                    && Math.abs(numericValue) < Long.MAX_VALUE
                    ? (Object) (long) numericValue
                    : (Object) numericValue;
            case TEXT -> textValue;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureValue other)) {
            return false;
        }
        return type == other.type
                && booleanValue == other.booleanValue
                && Double.compare(numericValue, other.numericValue) == 0
                && Objects.equals(textValue, other.textValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, booleanValue, numericValue, textValue);
    }

    @Override
    public String toString() {
        return String.valueOf(toRaw());
    }
}
