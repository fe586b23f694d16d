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
 * Gives a name to a stream so that its outputs can be referred to as
 * {@code name.arg}.
 */
public final class AliasStream extends Stream {

    private final Stream stream;
    private final String name;

    public AliasStream(SourceRange location, Stream stream, String name, ExpressionSignature schema) {
        super(location, schema);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public AliasStream(Stream stream, String name) {
        this(null, stream, name, stream.schema());
    }

    public Stream stream() {
        return stream;
    }

    public String name() {
        return name;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return stream.iterateSlots2(scope, into);
    }

    @Override
    public AliasStream clone() {
        return new AliasStream(location, stream.clone(), name, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAliasStream(this)) {
            stream.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return Table.parenthesize(stream) + " as " + name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasStream)) return false;
        AliasStream that = (AliasStream) obj;
        return stream.equals(that.stream) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("alias", stream, name);
    }

    @Override
    public String toString() {
        return "AliasStream(" + stream + ", " + name + ")";
    }
}
