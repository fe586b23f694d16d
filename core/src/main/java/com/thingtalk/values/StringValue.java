package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.Objects;

/**
 * Free-form string constant.
 */
public final class StringValue extends Value {

    private final String value;

    public StringValue(SourceRange location, String value) {
        super(location);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public StringValue(String value) {
        this(null, value);
    }

    public String value() {
        return value;
    }

    @Override
    public Type getType() {
        return PrimitiveType.STRING;
    }

    @Override
    public Object toJS() {
        return value;
    }

    @Override
    public StringValue clone() {
        return new StringValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitStringValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return SourceFormat.quote(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StringValue)) return false;
        return value.equals(((StringValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "String(" + value + ")";
    }
}
