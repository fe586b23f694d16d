package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.NotConstantException;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.util.Objects;

/**
 * Projection of one field out of every element of an array of compounds,
 * e.g. {@code name of attendees}.
 */
public final class ArrayFieldValue extends Value {

    private final Value value;
    private final String field;
    private final Type type;

    /**
     * Creates an array field projection.
     *
     * @param location the source location, or null
     * @param value the array-valued expression
     * @param field the field to extract
     * @param type the resolved result type, or null before type checking
     */
    public ArrayFieldValue(SourceRange location, Value value, String field, Type type) {
        super(location);
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.type = type;
    }

    public ArrayFieldValue(Value value, String field) {
        this(null, value, field, null);
    }

    public Value value() {
        return value;
    }

    public String field() {
        return field;
    }

    @Override
    public Type getType() {
        return type != null ? type : PrimitiveType.ANY;
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
    public ArrayFieldValue clone() {
        return new ArrayFieldValue(location, value.clone(), field, type);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitArrayFieldValue(this)) {
            value.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return field + " of " + value.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayFieldValue)) return false;
        ArrayFieldValue that = (ArrayFieldValue) obj;
        return value.equals(that.value) && field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, field);
    }

    @Override
    public String toString() {
        return "ArrayField(" + value + ", " + field + ")";
    }
}
