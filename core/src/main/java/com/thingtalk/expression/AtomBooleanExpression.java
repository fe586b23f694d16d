package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.FilterSlot;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.Slots;
import com.thingtalk.values.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Comparison of an output argument against a value: {@code name op value}.
 *
 * <p>The value is mutable so that slot filling can replace it in place.
 */
public final class AtomBooleanExpression extends BooleanExpression {

    private static final Set<String> INFIX_OPERATORS =
        Set.of("==", "!=", ">=", "<=", ">", "<", "=~", "~=");

    private final String name;
    private final String operator;
    private Value value;

    public AtomBooleanExpression(SourceRange location, String name, String operator, Value value) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public AtomBooleanExpression(String name, String operator, Value value) {
        this(null, name, operator, value);
    }

    public String name() {
        return name;
    }

    public String operator() {
        return operator;
    }

    public Value value() {
        return value;
    }

    public void setValue(Value value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    static boolean isInfix(String operator) {
        return INFIX_OPERATORS.contains(operator);
    }

    @Override
    public void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        ArgumentDef arg = schema == null ? null : schema.getArgument(name);
        Slots.recursiveYieldArraySlots(new FilterSlot(primitive, scope, arg, this), into);
    }

    @Override
    public AtomBooleanExpression clone() {
        return new AtomBooleanExpression(location, name, operator, value.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAtomBooleanExpression(this)) {
            value.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    protected int priority() {
        return isInfix(operator) ? PRIORITY_COMPARISON : PRIORITY_PRIMARY;
    }

    @Override
    public String toSource() {
        if (isInfix(operator)) {
            return name + " " + operator + " " + value.toSource();
        }
        return operator + "(" + name + ", " + value.toSource() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AtomBooleanExpression)) return false;
        AtomBooleanExpression that = (AtomBooleanExpression) obj;
        return name.equals(that.name) && operator.equals(that.operator) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, operator, value);
    }

    @Override
    public String toString() {
        return "Atom(" + name + ", " + operator + ", " + value + ")";
    }
}
