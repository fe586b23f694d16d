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
 * The past results of a table within {@code delta} (a duration) of the
 * {@code base} date.
 */
public final class HistoryTable extends Table {

    private Value base;
    private Value delta;
    private final Table table;

    public HistoryTable(SourceRange location, Value base, Value delta, Table table, ExpressionSignature schema) {
        super(location, schema);
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.delta = Objects.requireNonNull(delta, "delta must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    public HistoryTable(Value base, Value delta, Table table) {
        this(null, base, delta, table, table.schema());
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

    public Table table() {
        return table;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = table.iterateSlots2(scope, into);
        Slots.recursiveYieldArraySlots(new FieldSlot(inner.primitive(), inner.scope(), PrimitiveType.DATE,
            "history", "base", this::base, this::setBase), into);
        Slots.recursiveYieldArraySlots(new FieldSlot(inner.primitive(), inner.scope(), new MeasureType("ms"),
            "history", "delta", this::delta, this::setDelta), into);
        return inner;
    }

    @Override
    public HistoryTable clone() {
        return new HistoryTable(location, base.clone(), delta.clone(), table.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitHistoryTable(this)) {
            base.visit(visitor);
            delta.visit(visitor);
            table.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "history " + base.toSource() + ", " + delta.toSource() + " of " + parenthesize(table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HistoryTable)) return false;
        HistoryTable that = (HistoryTable) obj;
        return base.equals(that.base) && delta.equals(that.delta) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash("history", base, delta, table);
    }

    @Override
    public String toString() {
        return "HistoryTable(" + base + ", " + delta + ", " + table + ")";
    }
}
