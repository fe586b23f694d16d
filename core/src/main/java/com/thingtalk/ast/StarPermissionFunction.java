package com.thingtalk.ast;

/**
 * Permission for every function of every class. There is a
 * single instance.
 */
public final class StarPermissionFunction extends PermissionFunction {

    private static final StarPermissionFunction INSTANCE = new StarPermissionFunction();

    private StarPermissionFunction() {
        super(null);
    }

    public static StarPermissionFunction get() {
        return INSTANCE;
    }

    @Override
    public StarPermissionFunction clone() {
        return this;
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitStarPermissionFunction(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "*";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StarPermissionFunction;
    }

    @Override
    public int hashCode() {
        return StarPermissionFunction.class.hashCode();
    }

    @Override
    public String toString() {
        return "StarPermissionFunction";
    }
}
