package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Record-like value mapping field names to values.
 */
public final class ObjectValue extends Value {

    private final Map<String, Value> value;
    private final Type type;

    /**
     * Creates an object value.
     *
     * @param location the source location, or null
     * @param value the fields
     * @param type the compound type this object conforms to, or null
     */
    public ObjectValue(SourceRange location, Map<String, Value> value, Type type) {
        super(location);
        Objects.requireNonNull(value, "value must not be null");
        this.value = new LinkedHashMap<>(value);
        this.type = type;
    }

    public ObjectValue(Map<String, Value> value) {
        this(null, value, null);
    }

    /**
     * Returns the live field map.
     *
     * @return the fields
     */
    public Map<String, Value> value() {
        return value;
    }

    @Override
    public Type getType() {
        return type != null ? type : PrimitiveType.OBJECT;
    }

    @Override
    public boolean isConstant() {
        return value.values().stream().allMatch(Value::isConstant);
    }

    @Override
    public boolean isConcrete() {
        return value.values().stream().allMatch(Value::isConcrete);
    }

    @Override
    public Object toJS() {
        Map<String, Object> result = new LinkedHashMap<>();
        value.forEach((name, v) -> result.put(name, v.toJS()));
        return result;
    }

    @Override
    public ObjectValue clone() {
        Map<String, Value> copy = new LinkedHashMap<>();
        value.forEach((name, v) -> copy.put(name, v.clone()));
        return new ObjectValue(location, copy, type);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitObjectValue(this)) {
            for (Value v : value.values()) {
                v.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        List<String> parts = new ArrayList<>();
        value.forEach((name, v) -> parts.add(name + "=" + v.toSource()));
        return "{ " + String.join(", ", parts) + " }";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ObjectValue)) return false;
        return value.equals(((ObjectValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Object(" + value + ")";
    }
}
