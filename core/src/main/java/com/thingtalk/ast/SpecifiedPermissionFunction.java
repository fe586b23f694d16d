package com.thingtalk.ast;

import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.expression.TrueBooleanExpression;
import com.thingtalk.schema.FunctionDef;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.slots.Slots;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Permission for one function, restricted by a predicate over its input and
 * output parameters, e.g. {@code @com.bing.web_search filter query =~ "cats"}.
 */
public final class SpecifiedPermissionFunction extends PermissionFunction implements InvocationLike {

    private final String kind;
    private final String channel;
    private final BooleanExpression filter;
    private FunctionDef schema;

    public SpecifiedPermissionFunction(SourceRange location, String kind, String channel,
                                       BooleanExpression filter, FunctionDef schema) {
        super(location);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        this.schema = schema;
    }

    public SpecifiedPermissionFunction(String kind, String channel, BooleanExpression filter) {
        this(null, kind, channel, filter, null);
    }

    public String kind() {
        return kind;
    }

    public String channel() {
        return channel;
    }

    public BooleanExpression filter() {
        return filter;
    }

    @Override
    public FunctionDef schema() {
        return schema;
    }

    public void setSchema(FunctionDef schema) {
        this.schema = schema;
    }

    @Override
    public String selectorKind() {
        return kind;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        filter.iterateSlots2(schema, this, scope, into);
        return new SlotScope(this, Slots.makeScope(this));
    }

    @Override
    public SpecifiedPermissionFunction clone() {
        return new SpecifiedPermissionFunction(location, kind, channel, filter.clone(),
            schema == null ? null : schema.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitSpecifiedPermissionFunction(this)) {
            filter.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        if (filter instanceof TrueBooleanExpression) {
            return "@" + kind + "." + channel;
        }
        return "@" + kind + "." + channel + " filter " + filter.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SpecifiedPermissionFunction)) return false;
        SpecifiedPermissionFunction that = (SpecifiedPermissionFunction) obj;
        return kind.equals(that.kind) && channel.equals(that.channel) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, channel, filter);
    }

    @Override
    public String toString() {
        return "SpecifiedPermissionFunction(" + kind + ", " + channel + ", " + filter + ")";
    }
}
