package com.thingtalk.logical;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fires whenever the results of a table change. When watched arguments are
 * given, only changes to those arguments count.
 */
public final class MonitorStream extends Stream {

    private final Table table;
    private final List<String> args;

    /**
     * @param location the source location, or null
     * @param table the monitored table
     * @param args the watched arguments, or null to watch every argument
     * @param schema the output signature, or null
     */
    public MonitorStream(SourceRange location, Table table, List<String> args, ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.args = args == null ? null : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public MonitorStream(Table table, List<String> args) {
        this(null, table, args, table.schema());
    }

    public Table table() {
        return table;
    }

    public List<String> args() {
        return args;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return table.iterateSlots2(scope, into);
    }

    @Override
    public MonitorStream clone() {
        return new MonitorStream(location, table.clone(), args, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitMonitorStream(this)) {
            table.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String on = args == null ? "" : " on new [" + String.join(", ", args) + "]";
        return "monitor " + Table.parenthesize(table) + on;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MonitorStream)) return false;
        MonitorStream that = (MonitorStream) obj;
        return table.equals(that.table) && Objects.equals(args, that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash("monitor", table, args);
    }

    @Override
    public String toString() {
        return "MonitorStream(" + table + ", " + args + ")";
    }
}
