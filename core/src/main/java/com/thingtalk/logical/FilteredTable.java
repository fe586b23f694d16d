package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the results of a table that satisfy a predicate.
 *
 * <p>Examples:
 * <pre>
 *   (@com.twitter.search()), text =~ "java"
 *   (@org.weather.forecast(location=$here)), temperature >= 20C &amp;&amp; status == enum(sunny)
 * </pre>
 */
public final class FilteredTable extends Table {

    private final Table table;
    private final BooleanExpression filter;

    public FilteredTable(SourceRange location, Table table, BooleanExpression filter, ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    public FilteredTable(Table table, BooleanExpression filter) {
        this(null, table, filter, table.schema());
    }

    public Table table() {
        return table;
    }

    public BooleanExpression filter() {
        return filter;
    }

    /**
     * Adds the slots of the inner table, then those of the filter, resolved
     * against the inner table's schema and output scope.
     */
    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = table.iterateSlots2(scope, into);
        filter.iterateSlots2(table.schema(), inner.primitive(), inner.scope(), into);
        return inner;
    }

    @Override
    public FilteredTable clone() {
        return new FilteredTable(location, table.clone(), filter.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitFilteredTable(this)) {
            table.visit(visitor);
            filter.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return parenthesize(table) + ", " + filter.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FilteredTable)) return false;
        FilteredTable that = (FilteredTable) obj;
        return table.equals(that.table) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash("filter", table, filter);
    }

    @Override
    public String toString() {
        return "FilteredTable(" + table + ", " + filter + ")";
    }
}
