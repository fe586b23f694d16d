package com.thingtalk.ast;

/**
 * Permission for the builtins {@code now} and {@code notify}. There is a
 * single instance.
 */
public final class BuiltinPermissionFunction extends PermissionFunction {

    private static final BuiltinPermissionFunction INSTANCE = new BuiltinPermissionFunction();

    private BuiltinPermissionFunction() {
        super(null);
    }

    public static BuiltinPermissionFunction get() {
        return INSTANCE;
    }

    @Override
    public BuiltinPermissionFunction clone() {
        return this;
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitBuiltinPermissionFunction(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "notify";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BuiltinPermissionFunction;
    }

    @Override
    public int hashCode() {
        return BuiltinPermissionFunction.class.hashCode();
    }

    @Override
    public String toString() {
        return "BuiltinPermissionFunction";
    }
}
