package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

/**
 * Placeholder ({@code $?}) for a value the user has not provided yet.
 *
 * <p>A local placeholder must be filled by the user on this device; a
 * remote one by the owner of a remote program.
 */
public final class UndefinedValue extends Value {

    private final boolean local;

    public UndefinedValue(SourceRange location, boolean local) {
        super(location);
        this.local = local;
    }

    public UndefinedValue(boolean local) {
        this(null, local);
    }

    public UndefinedValue() {
        this(null, true);
    }

    public boolean local() {
        return local;
    }

    @Override
    public Type getType() {
        return PrimitiveType.ANY;
    }

    @Override
    public boolean isUndefined() {
        return true;
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
        return null;
    }

    @Override
    public UndefinedValue clone() {
        return new UndefinedValue(location, local);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitUndefinedValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "$?";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UndefinedValue)) return false;
        return local == ((UndefinedValue) obj).local;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(local) + 31;
    }

    @Override
    public String toString() {
        return "Undefined(" + local + ")";
    }
}
