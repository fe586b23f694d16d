package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

/**
 * Boolean constant ({@code true} or {@code false}).
 */
public final class BooleanValue extends Value {

    private final boolean value;

    public BooleanValue(SourceRange location, boolean value) {
        super(location);
        this.value = value;
    }

    public BooleanValue(boolean value) {
        this(null, value);
    }

    public boolean value() {
        return value;
    }

    @Override
    public Type getType() {
        return PrimitiveType.BOOLEAN;
    }

    @Override
    public Object toJS() {
        return value;
    }

    @Override
    public BooleanValue clone() {
        return new BooleanValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitBooleanValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return Boolean.toString(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BooleanValue)) return false;
        return value == ((BooleanValue) obj).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return "Boolean(" + value + ")";
    }
}
