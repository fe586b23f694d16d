package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces the results of a table to a single result. The field {@code *}
 * is used with {@code count}.
 */
public final class AggregationTable extends Table {

    private final Table table;
    private final String field;
    private final String operator;
    private final String alias;
    private List<Type> overload;

    public AggregationTable(SourceRange location, Table table, String field, String operator, String alias,
                            ExpressionSignature schema, List<Type> overload) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.alias = alias;
        this.overload = overload == null ? null : new ArrayList<>(overload);
    }

    public AggregationTable(Table table, String field, String operator, String alias) {
        this(null, table, field, operator, alias, null, null);
    }

    public Table table() {
        return table;
    }

    public String field() {
        return field;
    }

    public String operator() {
        return operator;
    }

    public String alias() {
        return alias;
    }

    public List<Type> overload() {
        return overload;
    }

    public void setOverload(List<Type> overload) {
        this.overload = overload == null ? null : new ArrayList<>(overload);
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return table.iterateSlots2(scope, into);
    }

    @Override
    public AggregationTable clone() {
        return new AggregationTable(location, table.clone(), field, operator, alias, cloneSchema(), overload);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAggregationTable(this)) {
            table.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String as = alias == null ? "" : " as " + alias;
        String target = "*".equals(field) ? "" : " " + field;
        return "aggregate " + operator + target + as + " of " + parenthesize(table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregationTable)) return false;
        AggregationTable that = (AggregationTable) obj;
        return table.equals(that.table)
            && field.equals(that.field)
            && operator.equals(that.operator)
            && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash("aggregation", table, field, operator, alias);
    }

    @Override
    public String toString() {
        return "AggregationTable(" + table + ", " + operator + ", " + field + ", " + alias + ")";
    }
}
