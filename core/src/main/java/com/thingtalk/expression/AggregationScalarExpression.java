package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.logical.Table;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An aggregate over the results of a table: {@code count(table)} or
 * {@code op(field of table)} for {@code sum}, {@code avg}, {@code min} and
 * {@code max}.
 */
public final class AggregationScalarExpression extends ScalarExpression {

    private final String operator;
    private final String field;
    private final Table list;

    /**
     * @param location the source location, or null
     * @param operator the aggregation operator
     * @param field the aggregated argument, or null to count results
     * @param list the aggregated table
     */
    public AggregationScalarExpression(SourceRange location, String operator, String field, Table list) {
        super(location);
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.field = field;
        this.list = Objects.requireNonNull(list, "list must not be null");
        if (field == null && !"count".equals(operator)) {
            throw new IllegalArgumentException("Aggregation " + operator + " needs a field");
        }
    }

    public AggregationScalarExpression(String operator, String field, Table list) {
        this(null, operator, field, list);
    }

    public String operator() {
        return operator;
    }

    public String field() {
        return field;
    }

    public Table list() {
        return list;
    }

    @Override
    public Type getType() {
        if ("count".equals(operator)) {
            return PrimitiveType.NUMBER;
        }
        if (list.schema() != null && list.schema().hasArgument(field)) {
            return list.schema().getArgType(field);
        }
        return PrimitiveType.ANY;
    }

    // the aggregated table is evaluated on its own and contributes no slots
    @Override
    public void iterateSlots2(InvocationLike primitive, Map<String, ScopeEntry> scope,
                              String baseTag, List<SlotItem> into) {
    }

    @Override
    public AggregationScalarExpression clone() {
        return new AggregationScalarExpression(location, operator, field, list.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAggregationScalarExpression(this)) {
            list.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        if (field == null) {
            return operator + "(" + list.toSource() + ")";
        }
        return operator + "(" + field + " of " + list.toSource() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregationScalarExpression)) return false;
        AggregationScalarExpression that = (AggregationScalarExpression) obj;
        return operator.equals(that.operator) && Objects.equals(field, that.field) && list.equals(that.list);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, field, list);
    }

    @Override
    public String toString() {
        return "Aggregation(" + operator + ", " + field + ", " + list + ")";
    }
}
