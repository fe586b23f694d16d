package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders the results of a table by one output argument.
 */
public final class SortedTable extends Table {

    private final Table table;
    private final String field;
    private final String direction;

    /**
     * @param location the source location, or null
     * @param table the inner table
     * @param field the argument to sort by
     * @param direction {@code asc} or {@code desc}
     * @param schema the output signature, or null
     * @throws IllegalArgumentException if the direction is neither asc nor desc
     */
    public SortedTable(SourceRange location, Table table, String field, String direction, ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        if (!direction.equals("asc") && !direction.equals("desc")) {
            throw new IllegalArgumentException("Invalid sort direction: " + direction);
        }
        this.direction = direction;
    }

    public SortedTable(Table table, String field, String direction) {
        this(null, table, field, direction, table.schema());
    }

    public Table table() {
        return table;
    }

    public String field() {
        return field;
    }

    public String direction() {
        return direction;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return table.iterateSlots2(scope, into);
    }

    @Override
    public SortedTable clone() {
        return new SortedTable(location, table.clone(), field, direction, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitSortedTable(this)) {
            table.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "sort " + field + " " + direction + " of " + parenthesize(table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortedTable)) return false;
        SortedTable that = (SortedTable) obj;
        return table.equals(that.table) && field.equals(that.field) && direction.equals(that.direction);
    }

    @Override
    public int hashCode() {
        return Objects.hash("sort", table, field, direction);
    }

    @Override
    public String toString() {
        return "SortedTable(" + table + ", " + field + ", " + direction + ")";
    }
}
