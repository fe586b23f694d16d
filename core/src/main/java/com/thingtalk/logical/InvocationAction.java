package com.thingtalk.logical;

import com.thingtalk.ast.Invocation;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An action performed by calling an action function.
 */
public final class InvocationAction extends Action {

    private final Invocation invocation;

    public InvocationAction(SourceRange location, Invocation invocation, ExpressionSignature schema) {
        super(location, schema);
        this.invocation = Objects.requireNonNull(invocation, "invocation must not be null");
    }

    public InvocationAction(Invocation invocation) {
        this(null, invocation, invocation.schema());
    }

    public Invocation invocation() {
        return invocation;
    }

    @Override
    public void iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        invocation.iterateSlots2(scope, into);
    }

    @Override
    public InvocationAction clone() {
        return new InvocationAction(location, invocation.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitInvocationAction(this)) {
            invocation.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return invocation.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InvocationAction)) return false;
        return invocation.equals(((InvocationAction) obj).invocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash("action", invocation);
    }

    @Override
    public String toString() {
        return "InvocationAction(" + invocation + ")";
    }
}
