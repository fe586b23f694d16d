package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.expression.ScalarExpression;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adds a computed column to every result of a table, named by the alias or,
 * when there is none, by the expression itself.
 */
public final class ComputeTable extends Table {

    private final Table table;
    private final ScalarExpression expression;
    private final String alias;

    /**
     * @param location the source location, or null
     * @param table the inner table
     * @param expression the computed scalar
     * @param alias the name of the new column, or null
     * @param schema the output signature, or null
     */
    public ComputeTable(SourceRange location, Table table, ScalarExpression expression, String alias,
                        ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = alias;
    }

    public ComputeTable(Table table, ScalarExpression expression, String alias) {
        this(null, table, expression, alias, null);
    }

    public Table table() {
        return table;
    }

    public ScalarExpression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = table.iterateSlots2(scope, into);
        expression.iterateSlots2(inner.primitive(), inner.scope(), "compute", into);
        return inner;
    }

    @Override
    public ComputeTable clone() {
        return new ComputeTable(location, table.clone(), expression.clone(), alias, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitComputeTable(this)) {
            table.visit(visitor);
            expression.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String as = alias == null ? "" : " as " + alias;
        return "compute " + expression.toSource() + as + " of " + parenthesize(table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComputeTable)) return false;
        ComputeTable that = (ComputeTable) obj;
        return table.equals(that.table) && expression.equals(that.expression) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash("compute", table, expression, alias);
    }

    @Override
    public String toString() {
        return "ComputeTable(" + table + ", " + expression + ", " + alias + ")";
    }
}
