package com.thingtalk.expression;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.types.Type;

import java.util.List;
import java.util.Map;

/**
 * A computed scalar: a constant or variable, an arithmetic or function
 * application over other scalars, an aggregate over a table, or a call to
 * a declared function.
 */
public abstract sealed class ScalarExpression extends Node
    permits PrimaryScalarExpression, DerivedScalarExpression,
            AggregationScalarExpression, VarRefScalarExpression {

    protected ScalarExpression(SourceRange location) {
        super(location);
    }

    @Override
    public abstract ScalarExpression clone();

    /**
     * Returns the type of the computed value, or Any when it is not known
     * before type checking.
     *
     * @return the type
     */
    public abstract Type getType();

    /**
     * Adds the slots of the constants inside this expression.
     *
     * @param primitive the invocation whose results are in scope, or null
     * @param scope the names available for parameter passing
     * @param baseTag the tag prefix of the yielded slots
     * @param into the list to append to
     */
    public abstract void iterateSlots2(InvocationLike primitive, Map<String, ScopeEntry> scope,
                                       String baseTag, List<SlotItem> into);
}
