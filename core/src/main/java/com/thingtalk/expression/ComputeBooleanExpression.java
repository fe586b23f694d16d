package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.FieldSlot;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.Slots;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Comparison of a computed scalar against a value, e.g.
 * {@code count(reviews) >= 10} or {@code distance(geo, $here) <= 5km}.
 */
public final class ComputeBooleanExpression extends BooleanExpression {

    private final ScalarExpression lhs;
    private final String operator;
    private Value rhs;
    private List<Type> overload;

    public ComputeBooleanExpression(SourceRange location, ScalarExpression lhs, String operator, Value rhs,
                                    List<Type> overload) {
        super(location);
        this.lhs = Objects.requireNonNull(lhs, "lhs must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.rhs = Objects.requireNonNull(rhs, "rhs must not be null");
        this.overload = overload == null ? null : new ArrayList<>(overload);
    }

    public ComputeBooleanExpression(ScalarExpression lhs, String operator, Value rhs) {
        this(null, lhs, operator, rhs, null);
    }

    public ScalarExpression lhs() {
        return lhs;
    }

    public String operator() {
        return operator;
    }

    public Value rhs() {
        return rhs;
    }

    public void setRhs(Value rhs) {
        this.rhs = Objects.requireNonNull(rhs, "rhs must not be null");
    }

    /**
     * Returns the resolved operator overload, or null before type checking.
     *
     * @return the overload types
     */
    public List<Type> overload() {
        return overload;
    }

    public void setOverload(List<Type> overload) {
        this.overload = overload == null ? null : new ArrayList<>(overload);
    }

    /**
     * Adds the slots of the computed side, then one slot for the compared
     * value, typed like the computed side when that type is known.
     */
    @Override
    public void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        lhs.iterateSlots2(primitive, scope, "compute_filter.lhs", into);
        Type lhsType = lhs.getType();
        Type rhsType = lhsType == PrimitiveType.ANY ? rhs.getType() : lhsType;
        Slots.recursiveYieldArraySlots(new FieldSlot(primitive, scope, rhsType, "compute_filter", "rhs",
            this::rhs, this::setRhs), into);
    }

    @Override
    public ComputeBooleanExpression clone() {
        return new ComputeBooleanExpression(location, lhs.clone(), operator, rhs.clone(), overload);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitComputeBooleanExpression(this)) {
            lhs.visit(visitor);
            rhs.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    protected int priority() {
        return AtomBooleanExpression.isInfix(operator) ? PRIORITY_COMPARISON : PRIORITY_PRIMARY;
    }

    @Override
    public String toSource() {
        if (AtomBooleanExpression.isInfix(operator)) {
            return lhs.toSource() + " " + operator + " " + rhs.toSource();
        }
        return operator + "(" + lhs.toSource() + ", " + rhs.toSource() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComputeBooleanExpression)) return false;
        ComputeBooleanExpression that = (ComputeBooleanExpression) obj;
        return lhs.equals(that.lhs) && operator.equals(that.operator) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, operator, rhs);
    }

    @Override
    public String toString() {
        return "Compute(" + lhs + ", " + operator + ", " + rhs + ")";
    }
}
