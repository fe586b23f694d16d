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
 * Keeps only the named output arguments of a table. Only the projected
 * names remain in scope for the nodes evaluated after it.
 */
public final class ProjectionTable extends Table {

    private final Table table;
    private final List<String> args;

    public ProjectionTable(SourceRange location, Table table, List<String> args, ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(args, "args must not be null");
        if (args.isEmpty()) {
            throw new IllegalArgumentException("Projection must name at least one argument");
        }
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public ProjectionTable(Table table, List<String> args) {
        this(null, table, args, null);
    }

    public Table table() {
        return table;
    }

    public List<String> args() {
        return args;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        SlotScope inner = table.iterateSlots2(scope, into);
        return new SlotScope(inner.primitive(), Slots.restrictScope(inner.scope(), args));
    }

    @Override
    public ProjectionTable clone() {
        return new ProjectionTable(location, table.clone(), args, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitProjectionTable(this)) {
            table.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "[" + String.join(", ", args) + "] of " + parenthesize(table);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProjectionTable)) return false;
        ProjectionTable that = (ProjectionTable) obj;
        return table.equals(that.table) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash("projection", table, args);
    }

    @Override
    public String toString() {
        return "ProjectionTable(" + table + ", " + args + ")";
    }
}
