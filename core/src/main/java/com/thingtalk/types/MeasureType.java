package com.thingtalk.types;

import java.util.Objects;

/**
 * Type of physical measures expressed in a base unit (e.g. {@code Measure(ms)},
 * {@code Measure(C)}).
 *
 * <p>An empty unit denotes a measure of any unit; it is only used on the
 * receiving side of assignability checks.
 */
public final class MeasureType implements Type {

    private final String unit;

    public MeasureType(String unit) {
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
    }

    public String unit() {
        return unit;
    }

    @Override
    public String typeName() {
        return "Measure(" + unit + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MeasureType)) return false;
        return unit.equals(((MeasureType) obj).unit);
    }

    @Override
    public int hashCode() {
        return unit.hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
