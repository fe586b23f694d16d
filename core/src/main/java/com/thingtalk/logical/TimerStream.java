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
 * Fires every {@code interval} starting at {@code base}, optionally
 * {@code frequency} times per interval.
 *
 * <p>A timer produces no outputs; nodes after it see an empty scope.
 */
public final class TimerStream extends Stream {

    private Value base;
    private Value interval;
    private Value frequency;

    public TimerStream(SourceRange location, Value base, Value interval, Value frequency, ExpressionSignature schema) {
        super(location, schema);
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.frequency = frequency;
    }

    public TimerStream(Value base, Value interval, Value frequency) {
        this(null, base, interval, frequency, null);
    }

    public Value base() {
        return base;
    }

    public void setBase(Value base) {
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    public Value interval() {
        return interval;
    }

    public void setInterval(Value interval) {
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
    }

    /**
     * @return the number of firings per interval, or null for one
     */
    public Value frequency() {
        return frequency;
    }

    public void setFrequency(Value frequency) {
        this.frequency = frequency;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        Slots.recursiveYieldArraySlots(new FieldSlot(null, scope, PrimitiveType.DATE,
            "timer", "base", this::base, this::setBase), into);
        Slots.recursiveYieldArraySlots(new FieldSlot(null, scope, new MeasureType("ms"),
            "timer", "interval", this::interval, this::setInterval), into);
        return SlotScope.empty();
    }

    @Override
    public TimerStream clone() {
        return new TimerStream(location, base.clone(), interval.clone(),
            frequency == null ? null : frequency.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitTimerStream(this)) {
            base.visit(visitor);
            interval.visit(visitor);
            if (frequency != null) {
                frequency.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String freq = frequency == null ? "" : ", frequency=" + frequency.toSource();
        return "timer(base=" + base.toSource() + ", interval=" + interval.toSource() + freq + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TimerStream)) return false;
        TimerStream that = (TimerStream) obj;
        return base.equals(that.base) && interval.equals(that.interval) && Objects.equals(frequency, that.frequency);
    }

    @Override
    public int hashCode() {
        return Objects.hash("timer", base, interval, frequency);
    }

    @Override
    public String toString() {
        return "TimerStream(" + base + ", " + interval + ", " + frequency + ")";
    }
}
