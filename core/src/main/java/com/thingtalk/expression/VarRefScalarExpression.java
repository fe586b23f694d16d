package com.thingtalk.expression;

import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.Selector;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A call to a function declared in the program, used as a scalar.
 */
public final class VarRefScalarExpression extends ScalarExpression {

    private final Selector selector;
    private final String name;
    private final List<InputParam> args;

    public VarRefScalarExpression(SourceRange location, Selector selector, String name, List<InputParam> args) {
        super(location);
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(args, "args must not be null");
        this.args = new ArrayList<>(args);
    }

    public VarRefScalarExpression(Selector selector, String name, List<InputParam> args) {
        this(null, selector, name, args);
    }

    public Selector selector() {
        return selector;
    }

    public String name() {
        return name;
    }

    public List<InputParam> args() {
        return args;
    }

    @Override
    public Type getType() {
        return PrimitiveType.ANY;
    }

    @Override
    public void iterateSlots2(InvocationLike primitive, Map<String, ScopeEntry> scope,
                              String baseTag, List<SlotItem> into) {
        // arguments of declared functions are bound at the declaration
    }

    @Override
    public VarRefScalarExpression clone() {
        List<InputParam> copy = new ArrayList<>(args.size());
        for (InputParam arg : args) {
            copy.add(arg.clone());
        }
        return new VarRefScalarExpression(location, selector.clone(), name, copy);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitVarRefScalarExpression(this)) {
            selector.visit(visitor);
            for (InputParam arg : args) {
                arg.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String prefix = selector.isBuiltin() ? "" : selector.toSource() + ".";
        return prefix + name + "(" + SourceFormat.join(args, InputParam::toSource, ", ") + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VarRefScalarExpression)) return false;
        VarRefScalarExpression that = (VarRefScalarExpression) obj;
        return selector.equals(that.selector) && name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, name, args);
    }

    @Override
    public String toString() {
        return "VarRefScalar(" + selector + ", " + name + ", " + args + ")";
    }
}
