package app.fuelfinder.engine.amenity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.OptionalInt;

/**
 * A live count reported by the amenity detail API, or the explicit unknown marker when the field was missing.
 * Unknown is never the same as zero.
 */
public final class AmenityCount {

    public static final String UNKNOWN_MARKER = "unknown";

    private static final AmenityCount UNKNOWN = new AmenityCount(null);

    private final Integer value;

    private AmenityCount(Integer value) {
        this.value = value;
    }

    public static AmenityCount of(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + value);
        }
        return new AmenityCount(value);
    }

    public static AmenityCount unknown() {
        return UNKNOWN;
    }

    /**
     * Maps an optional upstream number; absent, fractional garbage or negative values become unknown.
     */
    public static AmenityCount fromNullable(Double raw) {
        if (raw == null || !Double.isFinite(raw) || raw < 0 || raw != Math.floor(raw)) {
            return UNKNOWN;
        }
        return new AmenityCount(raw.intValue());
    }

    public boolean isKnown() {
        return value != null;
    }

    public OptionalInt value() {
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @JsonValue
    public Object jsonValue() {
        return value == null ? UNKNOWN_MARKER : value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AmenityCount)) {
            return false;
        }
        AmenityCount that = (AmenityCount) other;
        return value == null ? that.value == null : value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value == null ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        return value == null ? UNKNOWN_MARKER : value.toString();
    }
}
