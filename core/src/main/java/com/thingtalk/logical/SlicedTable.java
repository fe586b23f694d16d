package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.FieldSlot;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.slots.Slots;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.values.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps {@code limit} results of a table starting at position {@code base}.
 */
public final class SlicedTable extends Table {

    private final Table table;
    private Value base;
    private Value limit;

    public SlicedTable(SourceRange location, Table table, Value base, Value limit, ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.limit = Objects.requireNonNull(limit, "limit must not be null");
    }

    public SlicedTable(Table table, Value base, Value limit) {
        this(null, table, base, limit, table.schema());
    }

    public Table table() {
        return table;
    }

    public Value base() {
        return base;
    }

    public void setBase(Value base) {
        this.base = Objects.requireNonNull(base, "base must not be null");
    }

    public Value limit() {
        return limit;
    }

    public void setLimit(Value limit) {
        this.limit = Objects.requireNonNull(limit, "limit must not be null");
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = table.iterateSlots2(scope, into);
        Slots.recursiveYieldArraySlots(new FieldSlot(inner.primitive(), inner.scope(), PrimitiveType.NUMBER,
            "slice", "base", this::base, this::setBase), into);
        Slots.recursiveYieldArraySlots(new FieldSlot(inner.primitive(), inner.scope(), PrimitiveType.NUMBER,
            "slice", "limit", this::limit, this::setLimit), into);
        return inner;
    }

    @Override
    public SlicedTable clone() {
        return new SlicedTable(location, table.clone(), base.clone(), limit.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitSlicedTable(this)) {
            table.visit(visitor);
            base.visit(visitor);
            limit.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return parenthesize(table) + "[" + base.toSource() + " : " + limit.toSource() + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SlicedTable)) return false;
        SlicedTable that = (SlicedTable) obj;
        return table.equals(that.table) && base.equals(that.base) && limit.equals(that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash("slice", table, base, limit);
    }

    @Override
    public String toString() {
        return "SlicedTable(" + table + ", " + base + ", " + limit + ")";
    }
}
