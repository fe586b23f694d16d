package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.List;
import java.util.Map;

/**
 * The always-false predicate. There is a single instance.
 */
public final class FalseBooleanExpression extends BooleanExpression {

    private static final FalseBooleanExpression INSTANCE = new FalseBooleanExpression();

    private FalseBooleanExpression() {
        super(null);
    }

    public static FalseBooleanExpression get() {
        return INSTANCE;
    }

    @Override
    public void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        // constant
    }

    @Override
    public FalseBooleanExpression clone() {
        return this;
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitFalseBooleanExpression(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "false";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FalseBooleanExpression;
    }

    @Override
    public int hashCode() {
        return 1237;
    }

    @Override
    public String toString() {
        return "False";
    }
}
