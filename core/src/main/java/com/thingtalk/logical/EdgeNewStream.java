package com.thingtalk.logical;

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
 * Passes only the events of a stream that differ from the previous event.
 */
public final class EdgeNewStream extends Stream {

    private final Stream stream;

    public EdgeNewStream(SourceRange location, Stream stream, ExpressionSignature schema) {
        super(location, schema);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
    }

    public EdgeNewStream(Stream stream) {
        this(null, stream, stream.schema());
    }

    public Stream stream() {
        return stream;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return stream.iterateSlots2(scope, into);
    }

    @Override
    public EdgeNewStream clone() {
        return new EdgeNewStream(location, stream.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitEdgeNewStream(this)) {
            stream.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "edge " + Table.parenthesize(stream) + " on new";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EdgeNewStream)) return false;
        return stream.equals(((EdgeNewStream) obj).stream);
    }

    @Override
    public int hashCode() {
        return Objects.hash("edgenew", stream);
    }

    @Override
    public String toString() {
        return "EdgeNewStream(" + stream + ")";
    }
}
