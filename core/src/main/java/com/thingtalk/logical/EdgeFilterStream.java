package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Passes an event of a stream when the predicate becomes true: it holds for
 * this event and did not hold for the previous one.
 */
public final class EdgeFilterStream extends Stream {

    private final Stream stream;
    private final BooleanExpression filter;

    public EdgeFilterStream(SourceRange location, Stream stream, BooleanExpression filter, ExpressionSignature schema) {
        super(location, schema);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    public EdgeFilterStream(Stream stream, BooleanExpression filter) {
        this(null, stream, filter, stream.schema());
    }

    public Stream stream() {
        return stream;
    }

    public BooleanExpression filter() {
        return filter;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = stream.iterateSlots2(scope, into);
        filter.iterateSlots2(stream.schema(), inner.primitive(), inner.scope(), into);
        return inner;
    }

    @Override
    public EdgeFilterStream clone() {
        return new EdgeFilterStream(location, stream.clone(), filter.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitEdgeFilterStream(this)) {
            stream.visit(visitor);
            filter.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "edge " + Table.parenthesize(stream) + " on " + filter.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EdgeFilterStream)) return false;
        EdgeFilterStream that = (EdgeFilterStream) obj;
        return stream.equals(that.stream) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash("edgefilter", stream, filter);
    }

    @Override
    public String toString() {
        return "EdgeFilterStream(" + stream + ", " + filter + ")";
    }
}
