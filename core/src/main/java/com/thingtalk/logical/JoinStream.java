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
 * Runs a query on every event of a stream. The join parameters bind inputs
 * of the query to outputs of the event.
 */
public final class JoinStream extends Stream {

    private final Stream stream;
    private final Table table;
    private final List<InputParam> inParams;

    public JoinStream(SourceRange location, Stream stream, Table table, List<InputParam> inParams,
                      ExpressionSignature schema) {
        super(location, schema);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.table = Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        this.inParams = new ArrayList<>(inParams);
    }

    public JoinStream(Stream stream, Table table, List<InputParam> inParams) {
        this(null, stream, table, inParams, null);
    }

    public Stream stream() {
        return stream;
    }

    public Table table() {
        return table;
    }

    public List<InputParam> inParams() {
        return inParams;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope left = stream.iterateSlots2(scope, into);
        SlotScope right = table.iterateSlots2(Slots.mergeScopes(scope, left.scope()), into);
        return new SlotScope(null, Slots.mergeScopes(left.scope(), right.scope()));
    }

    @Override
    public JoinStream clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new JoinStream(location, stream.clone(), table.clone(), params, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitJoinStream(this)) {
            stream.visit(visitor);
            table.visit(visitor);
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
        return Table.parenthesize(stream) + " join " + Table.parenthesize(table) + on;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JoinStream)) return false;
        JoinStream that = (JoinStream) obj;
        return stream.equals(that.stream) && table.equals(that.table) && inParams.equals(that.inParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash("joinstream", stream, table, inParams);
    }

    @Override
    public String toString() {
        return "JoinStream(" + stream + ", " + table + ", " + inParams + ")";
    }
}
