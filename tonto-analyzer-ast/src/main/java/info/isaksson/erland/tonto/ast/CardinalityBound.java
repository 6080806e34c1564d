package info.isaksson.erland.tonto.ast;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/** One bound of a cardinality: a non-negative integer or {@code *} (many). */
public final class CardinalityBound {
    public static final CardinalityBound MANY = new CardinalityBound(null);

    private final Integer value;

    private CardinalityBound(Integer value) {
        this.value = value;
    }

    public static CardinalityBound of(int value) {
        return new CardinalityBound(value);
    }

    public boolean isMany() {
        return value == null;
    }

    /** Numeric value; only meaningful when {@link #isMany()} is false. */
    public int value() {
        if (value == null) throw new IllegalStateException("'*' has no numeric value");
        return value;
    }

    @JsonValue
    public Object jsonValue() {
        return value == null ? "*" : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CardinalityBound)) return false;
        return Objects.equals(value, ((CardinalityBound) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "*" : value.toString();
    }
}
