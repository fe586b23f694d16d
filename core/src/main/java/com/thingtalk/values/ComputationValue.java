package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.NotConstantException;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Scalar computation applied to operand values, e.g. {@code distance(geo, $location.home)}
 * or {@code count + 1}.
 *
 * <p>The operand list is mutable so that slot-filling can replace operands in
 * place. The overload (one type per operand, plus the result type) is
 * assigned by the type checker.
 */
public final class ComputationValue extends Value {

    private static final Set<String> INFIX_OPERATORS = Set.of("+", "-", "*", "/", "%", "**");

    private final String op;
    private final List<Value> operands;
    private List<Type> overload;

    public ComputationValue(SourceRange location, String op, List<Value> operands, List<Type> overload) {
        super(location);
        this.op = Objects.requireNonNull(op, "op must not be null");
        Objects.requireNonNull(operands, "operands must not be null");
        this.operands = new ArrayList<>(operands);
        this.overload = overload == null ? null : Collections.unmodifiableList(new ArrayList<>(overload));
    }

    public ComputationValue(String op, List<Value> operands) {
        this(null, op, operands, null);
    }

    public String op() {
        return op;
    }

    /**
     * Returns the live operand list.
     *
     * @return the operands
     */
    public List<Value> operands() {
        return operands;
    }

    /**
     * Returns the resolved overload: the type of each operand followed by
     * the result type.
     *
     * @return the overload, or null before type checking
     */
    public List<Type> overload() {
        return overload;
    }

    /**
     * Records the overload chosen by the type checker.
     *
     * @param overload operand types followed by the result type
     */
    public void setOverload(List<Type> overload) {
        Objects.requireNonNull(overload, "overload must not be null");
        if (overload.size() != operands.size() + 1) {
            throw new IllegalArgumentException(
                "Overload for " + op + " needs " + (operands.size() + 1) + " types, got " + overload.size());
        }
        this.overload = Collections.unmodifiableList(new ArrayList<>(overload));
    }

    @Override
    public Type getType() {
        if (overload != null) {
            return overload.get(overload.size() - 1);
        }
        return PrimitiveType.ANY;
    }

    @Override
    public boolean isConstant() {
        return false;
    }

    @Override
    public Object toJS() {
        throw new NotConstantException(toSource());
    }

    @Override
    public ComputationValue clone() {
        List<Value> copy = new ArrayList<>(operands.size());
        for (Value operand : operands) {
            copy.add(operand.clone());
        }
        return new ComputationValue(location, op, copy, overload);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitComputationValue(this)) {
            for (Value operand : operands) {
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
        return op + "(" + SourceFormat.join(operands, Value::toSource, ", ") + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComputationValue)) return false;
        ComputationValue that = (ComputationValue) obj;
        return op.equals(that.op) && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operands);
    }

    @Override
    public String toString() {
        return "Computation(" + op + ", " + operands + ")";
    }
}
