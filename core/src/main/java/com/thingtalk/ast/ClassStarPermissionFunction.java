package com.thingtalk.ast;

import java.util.Objects;

/**
 * Unconditional permission for every function of one class:
 * {@code @com.twitter.*}.
 */
public final class ClassStarPermissionFunction extends PermissionFunction {

    private final String kind;

    public ClassStarPermissionFunction(SourceRange location, String kind) {
        super(location);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ClassStarPermissionFunction(String kind) {
        this(null, kind);
    }

    public String kind() {
        return kind;
    }

    @Override
    public ClassStarPermissionFunction clone() {
        return new ClassStarPermissionFunction(location, kind);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitClassStarPermissionFunction(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "@" + kind + ".*";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ClassStarPermissionFunction)) return false;
        return kind.equals(((ClassStarPermissionFunction) obj).kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash("classstar", kind);
    }

    @Override
    public String toString() {
        return "ClassStarPermissionFunction(" + kind + ")";
    }
}
