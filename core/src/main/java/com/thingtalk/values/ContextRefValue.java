package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.NotConstantException;
import com.thingtalk.types.Type;

import java.util.Objects;

/**
 * Reference to a piece of user context, such as the current selection,
 * resolved by the dialogue component before compilation.
 */
public final class ContextRefValue extends Value {

    private final String name;
    private final Type type;

    public ContextRefValue(SourceRange location, String name, Type type) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public ContextRefValue(String name, Type type) {
        this(null, name, type);
    }

    public String name() {
        return name;
    }

    @Override
    public Type getType() {
        return type;
    }

    @Override
    public boolean isConstant() {
        return false;
    }

    @Override
    public boolean isConcrete() {
        return false;
    }

    @Override
    public Object toJS() {
        throw new NotConstantException(toSource());
    }

    @Override
    public ContextRefValue clone() {
        return new ContextRefValue(location, name, type);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitContextRefValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "$context." + name + " : " + type;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContextRefValue)) return false;
        return name.equals(((ContextRefValue) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "ContextRef(" + name + ", " + type + ")";
    }
}
