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
 * Disjunction ({@code ||}) of any number of operands. An empty disjunction
 * is false.
 */
public final class OrBooleanExpression extends BooleanExpression {

    private final List<BooleanExpression> operands;

    public OrBooleanExpression(SourceRange location, List<BooleanExpression> operands) {
        super(location);
        Objects.requireNonNull(operands, "operands must not be null");
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
    }

    public OrBooleanExpression(List<BooleanExpression> operands) {
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
    public OrBooleanExpression clone() {
        List<BooleanExpression> copy = new ArrayList<>(operands.size());
        for (BooleanExpression operand : operands) {
            copy.add(operand.clone());
        }
        return new OrBooleanExpression(location, copy);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitOrBooleanExpression(this)) {
            for (BooleanExpression operand : operands) {
                operand.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    protected int priority() {
        return PRIORITY_OR;
    }

    @Override
    public String toSource() {
        if (operands.isEmpty()) {
            return "false";
        }
        List<String> parts = new ArrayList<>(operands.size());
        for (BooleanExpression operand : operands) {
            parts.add(operandSource(operand));
        }
        return String.join(" || ", parts);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OrBooleanExpression)) return false;
        return operands.equals(((OrBooleanExpression) obj).operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash("or", operands);
    }

    @Override
    public String toString() {
        return "Or(" + operands + ")";
    }
}
