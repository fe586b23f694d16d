package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of values.
 *
 * <p>The element list is mutable so that slot-filling can replace single
 * elements in place. The declared element type, when present, wins over the
 * type of the first element.
 */
public final class ArrayValue extends Value {

    private final List<Value> values;
    private final Type elementType;

    /**
     * Creates an array value.
     *
     * @param location the source location, or null
     * @param values the elements
     * @param elementType the declared element type, or null to infer it
     */
    public ArrayValue(SourceRange location, List<Value> values, Type elementType) {
        super(location);
        Objects.requireNonNull(values, "values must not be null");
        this.values = new ArrayList<>(values);
        this.elementType = elementType;
    }

    public ArrayValue(List<Value> values) {
        this(null, values, null);
    }

    /**
     * Returns the live element list.
     *
     * @return the elements
     */
    public List<Value> values() {
        return values;
    }

    public Type elementType() {
        return elementType;
    }

    @Override
    public Type getType() {
        if (elementType != null) {
            return new ArrayType(elementType);
        }
        if (!values.isEmpty()) {
            return new ArrayType(values.get(0).getType());
        }
        return new ArrayType(PrimitiveType.ANY);
    }

    @Override
    public boolean isConstant() {
        return values.stream().allMatch(Value::isConstant);
    }

    @Override
    public boolean isConcrete() {
        return values.stream().allMatch(Value::isConcrete);
    }

    @Override
    public Object toJS() {
        List<Object> result = new ArrayList<>(values.size());
        for (Value v : values) {
            result.add(v.toJS());
        }
        return result;
    }

    @Override
    public ArrayValue clone() {
        List<Value> copy = new ArrayList<>(values.size());
        for (Value v : values) {
            copy.add(v.clone());
        }
        return new ArrayValue(location, copy, elementType);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitArrayValue(this)) {
            for (Value v : values) {
                v.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "[" + SourceFormat.join(values, Value::toSource, ", ") + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayValue)) return false;
        return values.equals(((ArrayValue) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Array(" + values + ")";
    }
}
