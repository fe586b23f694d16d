package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Negation of a predicate.
 */
public final class NotBooleanExpression extends BooleanExpression {

    private final BooleanExpression expr;

    public NotBooleanExpression(SourceRange location, BooleanExpression expr) {
        super(location);
        this.expr = Objects.requireNonNull(expr, "expr must not be null");
    }

    public NotBooleanExpression(BooleanExpression expr) {
        this(null, expr);
    }

    public BooleanExpression expr() {
        return expr;
    }

    @Override
    public void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        expr.iterateSlots2(schema, primitive, scope, into);
    }

    @Override
    public NotBooleanExpression clone() {
        return new NotBooleanExpression(location, expr.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitNotBooleanExpression(this)) {
            expr.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "!" + operandSource(expr);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NotBooleanExpression)) return false;
        return expr.equals(((NotBooleanExpression) obj).expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash("not", expr);
    }

    @Override
    public String toString() {
        return "Not(" + expr + ")";
    }
}
