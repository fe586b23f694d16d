package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ArrayIndexSlot;
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
 * Picks results of a table by position (1-based; negative counts from the
 * end).
 */
public final class IndexTable extends Table {

    private final Table table;
    private final List<Value> indices;

    public IndexTable(SourceRange location, Table table, List<Value> indices, ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(indices, "indices must not be null");
        this.indices = new ArrayList<>(indices);
    }

    public IndexTable(Table table, List<Value> indices) {
        this(null, table, indices, table.schema());
    }

    public Table table() {
        return table;
    }

    /**
     * Returns the live list of indices.
     *
     * @return the indices
     */
    public List<Value> indices() {
        return indices;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = table.iterateSlots2(scope, into);
        for (int i = 0; i < indices.size(); i++) {
            Slots.recursiveYieldArraySlots(new ArrayIndexSlot(inner.primitive(), inner.scope(),
                PrimitiveType.NUMBER, indices, "table.index", i), into);
        }
        return inner;
    }

    @Override
    public IndexTable clone() {
        List<Value> copy = new ArrayList<>(indices.size());
        for (Value index : indices) {
            copy.add(index.clone());
        }
        return new IndexTable(location, table.clone(), copy, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitIndexTable(this)) {
            table.visit(visitor);
            for (Value index : indices) {
                index.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return parenthesize(table) + "[" + SourceFormat.join(indices, Value::toSource, ", ") + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IndexTable)) return false;
        IndexTable that = (IndexTable) obj;
        return table.equals(that.table) && indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash("index", table, indices);
    }

    @Override
    public String toString() {
        return "IndexTable(" + table + ", " + indices + ")";
    }
}
