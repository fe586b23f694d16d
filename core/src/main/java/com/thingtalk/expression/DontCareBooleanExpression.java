package com.thingtalk.expression;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Marks an argument the user explicitly does not care about. Always true at
 * runtime; it only stops the argument from being asked for.
 */
public final class DontCareBooleanExpression extends BooleanExpression {

    private final String name;

    public DontCareBooleanExpression(SourceRange location, String name) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public DontCareBooleanExpression(String name) {
        this(null, name);
    }

    public String name() {
        return name;
    }

    @Override
    public void iterateSlots2(ExpressionSignature schema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        // nothing to fill
    }

    @Override
    public DontCareBooleanExpression clone() {
        return new DontCareBooleanExpression(location, name);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitDontCareBooleanExpression(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "true(" + name + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DontCareBooleanExpression)) return false;
        return name.equals(((DontCareBooleanExpression) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("dontcare", name);
    }

    @Override
    public String toString() {
        return "DontCare(" + name + ")";
    }
}
