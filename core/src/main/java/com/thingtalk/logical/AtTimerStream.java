package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ArrayIndexSlot;
import com.thingtalk.slots.FieldSlot;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.slots.Slots;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.util.SourceFormat;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fires every day at each of the given times of day, until the optional
 * expiration date.
 */
public final class AtTimerStream extends Stream {

    private final List<Value> time;
    private Value expirationDate;

    public AtTimerStream(SourceRange location, List<Value> time, Value expirationDate, ExpressionSignature schema) {
        super(location, schema);
        Objects.requireNonNull(time, "time must not be null");
        if (time.isEmpty()) {
            throw new IllegalArgumentException("Timer needs at least one time of day");
        }
        this.time = new ArrayList<>(time);
        this.expirationDate = expirationDate;
    }

    public AtTimerStream(List<Value> time, Value expirationDate) {
        this(null, time, expirationDate, null);
    }

    /**
     * Returns the live list of times of day.
     *
     * @return the times
     */
    public List<Value> time() {
        return time;
    }

    public Value expirationDate() {
        return expirationDate;
    }

    public void setExpirationDate(Value expirationDate) {
        this.expirationDate = expirationDate;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        for (int i = 0; i < time.size(); i++) {
            Slots.recursiveYieldArraySlots(new ArrayIndexSlot(null, scope, PrimitiveType.TIME, time, "attimer.time", i), into);
        }
        if (expirationDate != null) {
            Slots.recursiveYieldArraySlots(new FieldSlot(null, scope, PrimitiveType.DATE,
                "attimer", "expiration_date", this::expirationDate, this::setExpirationDate), into);
        }
        return SlotScope.empty();
    }

    @Override
    public AtTimerStream clone() {
        List<Value> copy = new ArrayList<>(time.size());
        for (Value value : time) {
            copy.add(value.clone());
        }
        return new AtTimerStream(location, copy, expirationDate == null ? null : expirationDate.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAtTimerStream(this)) {
            for (Value value : time) {
                value.visit(visitor);
            }
            if (expirationDate != null) {
                expirationDate.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String expiration = expirationDate == null ? "" : ", expiration_date=" + expirationDate.toSource();
        return "attimer(time=[" + SourceFormat.join(time, Value::toSource, ", ") + "]" + expiration + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AtTimerStream)) return false;
        AtTimerStream that = (AtTimerStream) obj;
        return time.equals(that.time) && Objects.equals(expirationDate, that.expirationDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash("attimer", time, expirationDate);
    }

    @Override
    public String toString() {
        return "AtTimerStream(" + time + ", " + expirationDate + ")";
    }
}
