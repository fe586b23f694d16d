package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.List;
import java.util.Map;

/**
 * The always-true predicate. There is a single instance.
 */
public final class TrueBooleanExpression extends BooleanExpression {

    private static final TrueBooleanExpression INSTANCE = new TrueBooleanExpression();

    private TrueBooleanExpression() {
        super(null);
    }

    public static TrueBooleanExpression get() {
        return INSTANCE;
    }

    @Override
    public void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        // constant
    }

    @Override
    public TrueBooleanExpression clone() {
        return this;
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitTrueBooleanExpression(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "true";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TrueBooleanExpression;
    }

    @Override
    public int hashCode() {
        return 1231;
    }

    @Override
    public String toString() {
        return "True";
    }
}
