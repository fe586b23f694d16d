package com.thingtalk.logical;

import com.thingtalk.ast.Invocation;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A table computed by calling a query function.
 */
public final class InvocationTable extends Table {

    private final Invocation invocation;

    public InvocationTable(SourceRange location, Invocation invocation, ExpressionSignature schema) {
        super(location, schema);
        this.invocation = Objects.requireNonNull(invocation, "invocation must not be null");
    }

    public InvocationTable(Invocation invocation) {
        this(null, invocation, invocation.schema());
    }

    public Invocation invocation() {
        return invocation;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return invocation.iterateSlots2(scope, into);
    }

    @Override
    public InvocationTable clone() {
        return new InvocationTable(location, invocation.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitInvocationTable(this)) {
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
        if (!(obj instanceof InvocationTable)) return false;
        return invocation.equals(((InvocationTable) obj).invocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash("invocation", invocation);
    }

    @Override
    public String toString() {
        return "InvocationTable(" + invocation + ")";
    }
}
