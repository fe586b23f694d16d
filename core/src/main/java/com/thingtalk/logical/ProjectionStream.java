package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.slots.Slots;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps only the named output arguments of the events of a stream. Only the projected
 * names remain in scope for the nodes evaluated after it.
 */
public final class ProjectionStream extends Stream {

    private final Stream stream;
    private final List<String> args;

    public ProjectionStream(SourceRange location, Stream stream, List<String> args, ExpressionSignature schema) {
        super(location, schema);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        Objects.requireNonNull(args, "args must not be null");
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Projection must name at least one argument");
        }
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public ProjectionStream(Stream stream, List<String> args) {
        this(null, stream, args, null);
    }

    public Stream stream() {
        return stream;
    }

    public List<String> args() {
        return args;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = stream.iterateSlots2(scope, into);
        return new SlotScope(inner.primitive(), Slots.restrictScope(inner.scope(), args));
    }

    @Override
    public ProjectionStream clone() {
        return new ProjectionStream(location, stream.clone(), args, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitProjectionStream(this)) {
            stream.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "[" + String.join(", ", args) + "] of " + Table.parenthesize(stream);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProjectionStream)) return false;
        ProjectionStream that = (ProjectionStream) obj;
        return stream.equals(that.stream) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash("projection", stream, args);
    }

    @Override
    public String toString() {
        return "ProjectionStream(" + stream + ", " + args + ")";
    }
}
