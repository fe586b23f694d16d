package com.thingtalk.logical;

import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.InvocationLike;
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
 * Reference to a query declared earlier in the program, called with the
 * given parameters.
 */
public final class VarRefTable extends Table implements InvocationLike {

    private final String name;
    private final List<InputParam> inParams;

    public VarRefTable(SourceRange location, String name, List<InputParam> inParams, ExpressionSignature schema) {
        super(location, schema);
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        this.inParams = new ArrayList<>(inParams);
    }

    public VarRefTable(String name, List<InputParam> inParams) {
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
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return Slots.iterateInputParams(this, scope, into);
    }

    @Override
    public VarRefTable clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new VarRefTable(location, name, params, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitVarRefTable(this)) {
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
        if (!(obj instanceof VarRefTable)) return false;
        VarRefTable that = (VarRefTable) obj;
        return name.equals(that.name) && inParams.equals(that.inParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inParams);
    }

    @Override
    public String toString() {
        return "VarRefTable(" + name + ", " + inParams + ")";
    }
}
