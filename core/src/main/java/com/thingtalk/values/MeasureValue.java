package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.MeasureType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.Objects;

/**
 * Physical quantity with a unit, e.g. {@code 5min} or {@code 20C}.
 *
 * <p>Units starting with {@code default} (e.g. {@code defaultTemperature})
 * are placeholders for the user's preferred unit; such a measure is not
 * concrete until the unit is resolved.
 */
public final class MeasureValue extends Value {

    private final double value;
    private final String unit;

    public MeasureValue(SourceRange location, double value, String unit) {
        super(location);
        this.value = value;
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
    }

    public MeasureValue(double value, String unit) {
        this(null, value, unit);
    }

    public double value() {
        return value;
    }

    public String unit() {
        return unit;
    }

    @Override
    public Type getType() {
        return new MeasureType(Units.normalizeUnit(unit));
    }

    @Override
    public boolean isConcrete() {
        return !unit.startsWith("default");
    }

    /**
     * Returns the quantity converted to the base unit of its dimension.
     */
    @Override
    public Object toJS() {
        return Units.transformToBaseUnit(value, unit);
    }

    @Override
    public MeasureValue clone() {
        return new MeasureValue(location, value, unit);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitMeasureValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return SourceFormat.number(value) + unit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MeasureValue)) return false;
        MeasureValue that = (MeasureValue) obj;
        return Double.compare(value, that.value) == 0 && unit.equals(that.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return "Measure(" + SourceFormat.number(value) + ", " + unit + ")";
    }
}
