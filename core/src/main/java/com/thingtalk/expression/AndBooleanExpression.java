package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction ({@code &&}) of any number of operands. An empty conjunction
 * is true.
 */
public final class AndBooleanExpression extends BooleanExpression {

    private final List<BooleanExpression> operands;

    public AndBooleanExpression(SourceRange location, List<BooleanExpression> operands) {
        super(location);
        Objects.requireNonNull(operands, "operands must not be null");
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public AndBooleanExpression(List<BooleanExpression> operands) {
        this(null, operands);
    }

    public List<BooleanExpression> operands() {
        return operands;
    }

    @Override
    public void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        for (BooleanExpression operand : operands) {
            operand.iterateSlots2(schema, primitive, scope, into);
        }
    }

    @Override
    public AndBooleanExpression clone() {
        List<BooleanExpression> copy = new ArrayList<>(operands.size());
        for (BooleanExpression operand : operands) {
            copy.add(operand.clone());
        }
        return new AndBooleanExpression(location, copy);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAndBooleanExpression(this)) {
            for (BooleanExpression operand : operands) {
                operand.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    protected int priority() {
        return PRIORITY_AND;
    }

    @Override
    public String toSource() {
        if (operands.isEmpty()) {
            return "true";
        }
        List<String> parts = new ArrayList<>(operands.size());
        for (BooleanExpression operand : operands) {
            parts.add(operandSource(operand));
        }
        return String.join(" && ", parts);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AndBooleanExpression)) return false;
        return operands.equals(((AndBooleanExpression) obj).operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash("and", operands);
    }

    @Override
    public String toString() {
        return "And(" + operands + ")";
    }
}
