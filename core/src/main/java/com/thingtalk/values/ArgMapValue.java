package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered map from parameter names to types.
 *
 * <p>Used by mixin imports to declare the parameters a configuration
 * mixin collects (e.g. the fields of a form).
 */
public final class ArgMapValue extends Value {

    private final Map<String, Type> value;

    public ArgMapValue(SourceRange location, Map<String, Type> value) {
        super(location);
        Objects.requireNonNull(value, "value must not be null");
        this.value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    public ArgMapValue(Map<String, Type> value) {
        this(null, value);
    }

    public Map<String, Type> value() {
        return value;
    }

    @Override
    public Type getType() {
        return PrimitiveType.ARG_MAP;
    }

    /**
     * Returns the map with each type printed in surface form.
     */
    @Override
    public Object toJS() {
        Map<String, String> result = new LinkedHashMap<>();
        value.forEach((name, type) -> result.put(name, type.toString()));
        return result;
    }

    @Override
    public ArgMapValue clone() {
        return new ArgMapValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitArgMapValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        List<String> parts = new ArrayList<>();
        value.forEach((name, type) -> parts.add(name + ":" + type));
        return "new ArgMap(" + String.join(", ", parts) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArgMapValue)) return false;
        return value.equals(((ArgMapValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ArgMap(" + value + ")";
    }
}
