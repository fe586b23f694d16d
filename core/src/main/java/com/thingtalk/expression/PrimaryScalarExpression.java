package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.slots.FieldSlot;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.Slots;
import com.thingtalk.types.Type;
import com.thingtalk.values.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A scalar given directly by a value: a constant or a reference to an
 * output argument in scope.
 */
public final class PrimaryScalarExpression extends ScalarExpression {

    private Value value;

    public PrimaryScalarExpression(SourceRange location, Value value) {
        super(location);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public PrimaryScalarExpression(Value value) {
        this(null, value);
    }

    public Value value() {
        return value;
    }

    public void setValue(Value value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public Type getType() {
        return value.getType();
    }

    @Override
    public void iterateSlots2(InvocationLike primitive, Map<String, ScopeEntry> scope,
                              String baseTag, List<SlotItem> into) {
        Slots.recursiveYieldArraySlots(new FieldSlot(primitive, scope, value.getType(), baseTag, "value",
            this::value, this::setValue), into);
    }

    @Override
    public PrimaryScalarExpression clone() {
        return new PrimaryScalarExpression(location, value.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitPrimaryScalarExpression(this)) {
            value.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return value.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PrimaryScalarExpression)) return false;
        return value.equals(((PrimaryScalarExpression) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("primary", value);
    }

    @Override
    public String toString() {
        return "Primary(" + value + ")";
    }
}
