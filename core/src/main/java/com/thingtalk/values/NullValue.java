package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

/**
 * The {@code null} literal, used to reset an optional parameter.
 */
public final class NullValue extends Value {

    public NullValue(SourceRange location) {
        super(location);
    }

    public NullValue() {
        this(null);
    }

    @Override
    public Type getType() {
        return PrimitiveType.ANY;
    }

    @Override
    public Object toJS() {
        return null;
    }

    @Override
    public NullValue clone() {
        return new NullValue(location);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitNullValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "null";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NullValue;
    }

    @Override
    public int hashCode() {
        return NullValue.class.hashCode();
    }

    @Override
    public String toString() {
        return "Null";
    }
}
