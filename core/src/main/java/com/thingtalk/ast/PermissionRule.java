package com.thingtalk.ast;

import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An access-control policy: programs whose source satisfies the principal
 * predicate may run the permitted query and action.
 *
 * <p>Example:
 * <pre>
 *   $policy {
 *     source == "mom"^^tt:username : @com.bing.web_search filter query =~ "cats" => notify;
 *   }
 * </pre>
 */
public final class PermissionRule extends Node {

    private final BooleanExpression principal;
    private final PermissionFunction query;
    private final PermissionFunction action;

    public PermissionRule(SourceRange location, BooleanExpression principal,
                          PermissionFunction query, PermissionFunction action) {
        super(location);
        this.principal = Objects.requireNonNull(principal, "principal must not be null");
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
    }

    public PermissionRule(BooleanExpression principal, PermissionFunction query, PermissionFunction action) {
        this(null, principal, query, action);
    }

    public BooleanExpression principal() {
        return principal;
    }

    public PermissionFunction query() {
        return query;
    }

    public PermissionFunction action() {
        return action;
    }

    /**
     * Adds the slots of the principal predicate, then of the query filter,
     * then of the action filter, which sees the outputs of the query.
     *
     * @param into the list to append to
     */
    public void iterateSlots2(List<SlotItem> into) {
        principal.iterateSlots2(null, null, Collections.emptyMap(), into);
        SlotScope scope = query.iterateSlots2(Collections.emptyMap(), into);
        action.iterateSlots2(scope.scope(), into);
    }

    public List<SlotItem> iterateSlots2() {
        List<SlotItem> slots = new ArrayList<>();
        iterateSlots2(slots);
        return slots;
    }

    @Override
    public PermissionRule clone() {
        return new PermissionRule(location, principal.clone(), query.clone(), action.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitPermissionRule(this)) {
            principal.visit(visitor);
            query.visit(visitor);
            action.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String querySource = query instanceof BuiltinPermissionFunction ? "now" : query.toSource();
        return "$policy {\n  " + principal.toSource() + " : " + querySource + " => " + action.toSource() + ";\n}";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PermissionRule)) return false;
        PermissionRule that = (PermissionRule) obj;
        return principal.equals(that.principal) && query.equals(that.query) && action.equals(that.action);
    }

    @Override
    public int hashCode() {
        return Objects.hash(principal, query, action);
    }

    @Override
    public String toString() {
        return "PermissionRule(" + principal + ", " + query + ", " + action + ")";
    }
}
