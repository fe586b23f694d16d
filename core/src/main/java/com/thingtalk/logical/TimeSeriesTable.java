package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.FieldSlot;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.slots.Slots;
import com.thingtalk.types.MeasureType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.values.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The events of a stream in a time window: those within {@code delta}
 * (a duration) of the {@code base} date.
 */
public final class TimeSeriesTable extends Table {

    private Value base;
    private Value delta;
    private final Stream stream;

    public TimeSeriesTable(SourceRange location, Value base, Value delta, Stream stream, ExpressionSignature schema) {
        super(location, schema);
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.delta = Objects.requireNonNull(delta, "delta must not be null");
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
    }

    public TimeSeriesTable(Value base, Value delta, Stream stream) {
        this(null, base, delta, stream, stream.schema());
    }

    public Value base() {
        return base;
    }

    public void setBase(Value base) {
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    public Value delta() {
        return delta;
    }

    public void setDelta(Value delta) {
        this.delta = Objects.requireNonNull(delta, "delta must not be null");
    }

    public Stream stream() {
        return stream;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = stream.iterateSlots2(scope, into);
        Slots.recursiveYieldArraySlots(new FieldSlot(inner.primitive(), inner.scope(), PrimitiveType.DATE,
            "history", "base", this::base, this::setBase), into);
        Slots.recursiveYieldArraySlots(new FieldSlot(inner.primitive(), inner.scope(), new MeasureType("ms"),
            "history", "delta", this::delta, this::setDelta), into);
        return inner;
    }

    @Override
    public TimeSeriesTable clone() {
        return new TimeSeriesTable(location, base.clone(), delta.clone(), stream.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitTimeSeriesTable(this)) {
            base.visit(visitor);
            delta.visit(visitor);
            stream.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "timeseries " + base.toSource() + ", " + delta.toSource() + " of " + parenthesize(stream);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TimeSeriesTable)) return false;
        TimeSeriesTable that = (TimeSeriesTable) obj;
        return base.equals(that.base) && delta.equals(that.delta) && stream.equals(that.stream);
    }

    @Override
    public int hashCode() {
        return Objects.hash("timeseries", base, delta, stream);
    }

    @Override
    public String toString() {
        return "TimeSeriesTable(" + base + ", " + delta + ", " + stream + ")";
    }
}
