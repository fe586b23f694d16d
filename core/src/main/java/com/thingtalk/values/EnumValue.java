package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.EnumType;
import com.thingtalk.types.Type;

import java.util.List;
import java.util.Objects;

/**
 * Enumerated constant, e.g. {@code enum on}.
 */
public final class EnumValue extends Value {

    private final String value;

    public EnumValue(SourceRange location, String value) {
        super(location);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public EnumValue(String value) {
        this(null, value);
    }

    public String value() {
        return value;
    }

    /**
     * Returns an enum type accepting this entry and any other.
     */
    @Override
    public Type getType() {
        return new EnumType(List.of(value, "*"));
    }

    @Override
    public Object toJS() {
        return value;
    }

    @Override
    public EnumValue clone() {
        return new EnumValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitEnumValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "enum " + value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EnumValue)) return false;
        return value.equals(((EnumValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Enum(" + value + ")";
    }
}
