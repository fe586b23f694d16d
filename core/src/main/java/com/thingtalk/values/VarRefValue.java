package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.NotConstantException;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.util.Objects;

/**
 * Reference to a parameter in scope, such as an output argument of a
 * previous function.
 *
 * <p>Names starting with {@code __const_} are placeholders for constants
 * that were abstracted out of the program; they count as constant.
 */
public final class VarRefValue extends Value {

    /** Prefix of placeholder names standing for abstracted constants */
    public static final String CONSTANT_PREFIX = "__const_";

    private final String name;
    private final Type type;

    /**
     * Creates a variable reference.
     *
     * @param location the source location, or null
     * @param name the referenced name
     * @param type the resolved type, or null before type checking
     */
    public VarRefValue(SourceRange location, String name, Type type) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type;
    }

    public VarRefValue(String name) {
        this(null, name, null);
    }

    public String name() {
        return name;
    }

    @Override
    public Type getType() {
        return type != null ? type : PrimitiveType.ANY;
    }

    @Override
    public boolean isConstant() {
        return name.startsWith(CONSTANT_PREFIX);
    }

    @Override
    public Object toJS() {
        throw new NotConstantException(toSource());
    }

    @Override
    public VarRefValue clone() {
        return new VarRefValue(location, name, type);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitVarRefValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VarRefValue)) return false;
        return name.equals(((VarRefValue) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "VarRef(" + name + ")";
    }
}
