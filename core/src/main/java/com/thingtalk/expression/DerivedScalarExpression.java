package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An operator applied to scalar operands: {@code +}, {@code -}, {@code *},
 * {@code /}, {@code %}, {@code **}, or a named function such as
 * {@code distance}, {@code max} or {@code count}.
 */
public final class DerivedScalarExpression extends ScalarExpression {

    private static final Set<String> INFIX_OPERATORS = Set.of("+", "-", "*", "/", "%", "**");

    private final String op;
    private final List<ScalarExpression> operands;
    private List<Type> overload;

    public DerivedScalarExpression(SourceRange location, String op, List<ScalarExpression> operands,
                                   List<Type> overload) {
        super(location);
        this.op = Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(operands, "operands must not be null");
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.overload = overload == null ? null : new ArrayList<>(overload);
    }

    public DerivedScalarExpression(String op, List<ScalarExpression> operands) {
        this(null, op, operands, null);
    }

    public String op() {
        return op;
    }

    public List<ScalarExpression> operands() {
        return operands;
    }

    public List<Type> overload() {
        return overload;
    }

    public void setOverload(List<Type> overload) {
        this.overload = overload == null ? null : new ArrayList<>(overload);
    }

    @Override
    public Type getType() {
        if (overload != null && !overload.isEmpty()) {
            return overload.get(overload.size() - 1);
        }
        return PrimitiveType.ANY;
    }

    @Override
    public void iterateSlots2(InvocationLike primitive, Map<String, ScopeEntry> scope,
                              String baseTag, List<SlotItem> into) {
        for (int i = 0; i < operands.size(); i++) {
            operands.get(i).iterateSlots2(primitive, scope, baseTag + "." + op + "." + i, into);
        }
    }

    @Override
    public DerivedScalarExpression clone() {
        List<ScalarExpression> copy = new ArrayList<>(operands.size());
        for (ScalarExpression operand : operands) {
            copy.add(operand.clone());
        }
        return new DerivedScalarExpression(location, op, copy, overload);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitDerivedScalarExpression(this)) {
            for (ScalarExpression operand : operands) {
                operand.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        if (INFIX_OPERATORS.contains(op) && operands.size() == 2) {
            return "(" + operands.get(0).toSource() + " " + op + " " + operands.get(1).toSource() + ")";
        }
        return op + "(" + SourceFormat.join(operands, ScalarExpression::toSource, ", ") + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DerivedScalarExpression)) return false;
        DerivedScalarExpression that = (DerivedScalarExpression) obj;
        return op.equals(that.op) && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operands);
    }

    @Override
    public String toString() {
        return "Derived(" + op + ", " + operands + ")";
    }
}
