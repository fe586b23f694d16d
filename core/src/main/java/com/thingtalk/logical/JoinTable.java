package com.thingtalk.logical;

import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.slots.Slots;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Cross product of two tables, where the join parameters bind inputs of the
 * right-hand side to outputs of the left-hand side.
 */
public final class JoinTable extends Table {

    private final Table lhs;
    private final Table rhs;
    private final List<InputParam> inParams;

    public JoinTable(SourceRange location, Table lhs, Table rhs, List<InputParam> inParams,
                     ExpressionSignature schema) {
        super(location, schema);
        this.lhs = Objects.requireNonNull(lhs, "lhs must not be null");
        this.rhs = Objects.requireNonNull(rhs, "rhs must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        this.inParams = new ArrayList<>(inParams);
    }

    public JoinTable(Table lhs, Table rhs, List<InputParam> inParams) {
        this(null, lhs, rhs, inParams, null);
    }

    public Table lhs() {
        return lhs;
    }

    public Table rhs() {
        return rhs;
    }

    public List<InputParam> inParams() {
        return inParams;
    }

    /**
     * Adds the slots of the left-hand side, then of the right-hand side,
     * which also sees the left-hand outputs. The result is the union of both
     * output scopes and has no single primitive.
     */
    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope left = lhs.iterateSlots2(scope, into);
        SlotScope right = rhs.iterateSlots2(Slots.mergeScopes(scope, left.scope()), into);
        return new SlotScope(null, Slots.mergeScopes(left.scope(), right.scope()));
    }

    @Override
    public JoinTable clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new JoinTable(location, lhs.clone(), rhs.clone(), params, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitJoinTable(this)) {
            lhs.visit(visitor);
            rhs.visit(visitor);
            for (InputParam param : inParams) {
                param.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String on = inParams.isEmpty() ? ""
            : " on (" + SourceFormat.join(inParams, InputParam::toSource, ", ") + ")";
        return parenthesize(lhs) + " join " + parenthesize(rhs) + on;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JoinTable)) return false;
        JoinTable that = (JoinTable) obj;
        return lhs.equals(that.lhs) && rhs.equals(that.rhs) && inParams.equals(that.inParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash("join", lhs, rhs, inParams);
    }

    @Override
    public String toString() {
        return "JoinTable(" + lhs + ", " + rhs + ", " + inParams + ")";
    }
}
