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
 * Reference to a stream declared earlier in the program, called with the
 * given parameters.
 */
public final class VarRefStream extends Stream implements InvocationLike {

    private final String name;
    private final List<InputParam> inParams;

    public VarRefStream(SourceRange location, String name, List<InputParam> inParams, ExpressionSignature schema) {
        super(location, schema);
        this.name = Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        this.inParams = new ArrayList<>(inParams);
    }

    public VarRefStream(String name, List<InputParam> inParams) {
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
    public VarRefStream clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new VarRefStream(location, name, params, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitVarRefStream(this)) {
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
        if (!(obj instanceof VarRefStream)) return false;
        VarRefStream that = (VarRefStream) obj;
        return name.equals(that.name) && inParams.equals(that.inParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, inParams);
    }

    @Override
    public String toString() {
        return "VarRefStream(" + name + ", " + inParams + ")";
    }
}
