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
 * Keeps the events of a stream that satisfy a predicate, e.g.
 * {@code (monitor (@org.weather.current(location=$here))), temperature <= 0C}.
 */
public final class FilteredStream extends Stream {

    private final Stream stream;
    private final BooleanExpression filter;

    public FilteredStream(SourceRange location, Stream stream, BooleanExpression filter, ExpressionSignature schema) {
        super(location, schema);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    public FilteredStream(Stream stream, BooleanExpression filter) {
        this(null, stream, filter, stream.schema());
    }

    public Stream stream() {
        return stream;
    }

    public BooleanExpression filter() {
        return filter;
    }

    /**
     * Adds the slots of the inner stream, then those of the filter, resolved
     * against the inner stream's schema and output scope.
     */
    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = stream.iterateSlots2(scope, into);
        filter.iterateSlots2(stream.schema(), inner.primitive(), inner.scope(), into);
        return inner;
    }

    @Override
    public FilteredStream clone() {
        return new FilteredStream(location, stream.clone(), filter.clone(), cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitFilteredStream(this)) {
            stream.visit(visitor);
            filter.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return Table.parenthesize(stream) + ", " + filter.toSource();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FilteredStream)) return false;
        FilteredStream that = (FilteredStream) obj;
        return stream.equals(that.stream) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash("filter", stream, filter);
    }

    @Override
    public String toString() {
        return "FilteredStream(" + stream + ", " + filter + ")";
    }
}
