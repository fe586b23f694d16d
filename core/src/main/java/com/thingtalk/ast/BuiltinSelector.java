package com.thingtalk.ast;

/**
 * Selector of the builtin pseudo-functions. A single shared instance exists,
 * so selectors can be compared by identity.
 */
public final class BuiltinSelector extends Selector {

    private static final BuiltinSelector INSTANCE = new BuiltinSelector();

    private BuiltinSelector() {
        super(null);
    }

    /**
     * Returns the builtin selector.
     *
     * @return the singleton
     */
    public static BuiltinSelector get() {
        return INSTANCE;
    }

    @Override
    public boolean isBuiltin() {
        return true;
    }

    @Override
    public BuiltinSelector clone() {
        return this;
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitBuiltinSelector(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "";
    }

    @Override
    public String toString() {
        return "Builtin";
    }
}
