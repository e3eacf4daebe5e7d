package com.al.ccda2omop.service.engine;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A typed value produced by a field transform.
 */
public final class FieldValue {

    public enum Kind {
        STRING, INTEGER, DECIMAL, TIMESTAMP
    }

    private final Kind kind;
    private final Object value;

    private FieldValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static FieldValue string(String value) {
        return new FieldValue(Kind.STRING, value);
    }

    public static FieldValue integer(long value) {
        return new FieldValue(Kind.INTEGER, value);
    }

    public static FieldValue decimal(double value) {
        return new FieldValue(Kind.DECIMAL, value);
    }

    public static FieldValue timestamp(LocalDateTime value) {
        return new FieldValue(Kind.TIMESTAMP, value);
    }

    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Integer view; decimals are truncated, other kinds yield null.
     */
    public Long asLong() {
        if (kind == Kind.INTEGER) {
            return (Long) value;
        }
        if (kind == Kind.DECIMAL) {
            return ((Double) value).longValue();
        }
        return null;
    }

    public Double asDouble() {
        if (kind == Kind.DECIMAL) {
            return (Double) value;
        }
        if (kind == Kind.INTEGER) {
            return ((Long) value).doubleValue();
        }
        return null;
    }

    public LocalDateTime asDateTime() {
        return kind == Kind.TIMESTAMP ? (LocalDateTime) value : null;
    }

    public String asString() {
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue)) {
            return false;
        }
        FieldValue other = (FieldValue) o;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
