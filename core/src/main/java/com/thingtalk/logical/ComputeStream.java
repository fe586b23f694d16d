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
 * Adds a computed column to every event of a stream, named by the alias or,
 * when there is none, by the expression itself.
 */
public final class ComputeStream extends Stream {

    private final Stream stream;
    private final ScalarExpression expression;
    private final String alias;

    /**
     * @param location the source location, or null
     * @param stream the inner stream
     * @param expression the computed scalar
     * @param alias the name of the new column, or null
     * @param schema the output signature, or null
     */
    public ComputeStream(SourceRange location, Stream stream, ScalarExpression expression, String alias,
                        ExpressionSignature schema) {
        super(location, schema);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = alias;
    }

    public ComputeStream(Stream stream, ScalarExpression expression, String alias) {
        this(null, stream, expression, alias, null);
    }

    public Stream stream() {
        return stream;
    }

    public ScalarExpression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = stream.iterateSlots2(scope, into);
        expression.iterateSlots2(inner.primitive(), inner.scope(), "compute", into);
        return inner;
    }

    @Override
    public ComputeStream clone() {
        return new ComputeStream(location, stream.clone(), expression.clone(), alias, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitComputeStream(this)) {
            stream.visit(visitor);
            expression.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String as = alias == null ? "" : " as " + alias;
        return "compute " + expression.toSource() + as + " of " + Table.parenthesize(stream);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComputeStream)) return false;
        ComputeStream that = (ComputeStream) obj;
        return stream.equals(that.stream) && expression.equals(that.expression) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash("compute", stream, expression, alias);
    }

    @Override
    public String toString() {
        return "ComputeStream(" + stream + ", " + expression + ", " + alias + ")";
    }
}
