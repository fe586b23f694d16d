package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

/**
 * Numeric constant, stored as a double.
 */
public final class NumberValue extends Value {

    private final double value;

    public NumberValue(SourceRange location, double value) {
        super(location);
        this.value = value;
    }

    public NumberValue(double value) {
        this(null, value);
    }

    public double value() {
        return value;
    }

    @Override
    public Type getType() {
        return PrimitiveType.NUMBER;
    }

    @Override
    public Object toJS() {
        return value;
    }

    @Override
    public NumberValue clone() {
        return new NumberValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitNumberValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return SourceFormat.number(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NumberValue)) return false;
        return Double.compare(value, ((NumberValue) obj).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "Number(" + SourceFormat.number(value) + ")";
    }
}
