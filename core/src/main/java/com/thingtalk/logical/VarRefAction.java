package com.thingtalk.logical;

import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.Slots;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Call to a procedure or action declared earlier in the program.
 */
public final class VarRefAction extends Action implements InvocationLike {

    private final String name;
    private final List<InputParam> inParams;

    public VarRefAction(SourceRange location, String name, List<InputParam> inParams, ExpressionSignature schema) {
        super(location, schema);
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        this.inParams = new ArrayList<>(inParams);
    }

    public VarRefAction(String name, List<InputParam> inParams) {
        this(null, name, inParams, null);
    }

    public String name() {
        return name;
    }

    @Override
    public List<InputParam> inParams() {
        return inParams;
    }

    @Override
    public void iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        Slots.iterateInputParams(this, scope, into);
    }

    @Override
    public VarRefAction clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new VarRefAction(location, name, params, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitVarRefAction(this)) {
            for (InputParam param : inParams) {
                param.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return name + "(" + SourceFormat.join(inParams, InputParam::toSource, ", ") + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VarRefAction)) return false;
        VarRefAction that = (VarRefAction) obj;
        return name.equals(that.name) && inParams.equals(that.inParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inParams);
    }

    @Override
    public String toString() {
        return "VarRefAction(" + name + ", " + inParams + ")";
    }
}
