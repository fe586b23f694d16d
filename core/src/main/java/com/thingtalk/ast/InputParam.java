package com.thingtalk.ast;

import com.thingtalk.values.Value;

import java.util.Objects;

/**
 * A named argument bound at a call site: {@code name=value}.
 *
 * <p>The value is replaceable so that slot filling can update it in place.
 */
public final class InputParam extends Node {

    private final String name;
    private Value value;

    public InputParam(SourceRange location, String name, Value value) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public InputParam(String name, Value value) {
        this(null, name, value);
    }

    public String name() {
        return name;
    }

    public Value value() {
        return value;
    }

    public void setValue(Value value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public InputParam clone() {
        return new InputParam(location, name, value.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitInputParam(this)) {
            value.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return name + "=" + value.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InputParam)) return false;
        InputParam that = (InputParam) obj;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return "InputParam(" + name + ", " + value + ")";
    }
}
