package com.thingtalk.expression;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.optimizer.FilterOptimizer;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.List;
import java.util.Map;

/**
 * A predicate over the results of a query or stream.
 *
 * <p>{@link TrueBooleanExpression} and {@link FalseBooleanExpression} are
 * shared singletons; every other variant is an ordinary tree node.
 */
public abstract sealed class BooleanExpression extends Node
    permits AndBooleanExpression, OrBooleanExpression, NotBooleanExpression,
            AtomBooleanExpression, ExternalBooleanExpression, DontCareBooleanExpression,
            ComputeBooleanExpression, TrueBooleanExpression, FalseBooleanExpression {

    /** Binding strength used to parenthesize nested expressions when printing. */
    protected static final int PRIORITY_OR = 0;
    protected static final int PRIORITY_AND = 1;
    protected static final int PRIORITY_COMPARISON = 2;
    protected static final int PRIORITY_PRIMARY = 3;

    protected BooleanExpression(SourceRange location) {
        super(location);
    }

    @Override
    public abstract BooleanExpression clone();

    /**
     * Adds the slots of this predicate.
     *
     * @param schema the signature the predicate filters, used to find the
     *        argument behind each atom; may be null
     * @param primitive the invocation whose results are filtered, or null
     * @param scope the names available for parameter passing
     * @param into the list to append to
     */
    public abstract void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                                       Map<String, ScopeEntry> scope, List<SlotItem> into);

    /**
     * Returns a simplified, equivalent predicate. This expression is not
     * modified.
     *
     * @return the optimized predicate
     * @see FilterOptimizer
     */
    public BooleanExpression optimize() {
        return new FilterOptimizer().optimize(this);
    }

    protected int priority() {
        return PRIORITY_PRIMARY;
    }

    /**
     * Prints an operand, in parentheses if it binds less tightly than this
     * expression.
     *
     * @param operand the operand
     * @return the operand source
     */
    protected String operandSource(BooleanExpression operand) {
        String source = operand.toSource();
        return operand.priority() < priority() ? "(" + source + ")" : source;
    }

    public static TrueBooleanExpression trueExpression() {
        return TrueBooleanExpression.get();
    }

    public static FalseBooleanExpression falseExpression() {
        return FalseBooleanExpression.get();
    }
}
