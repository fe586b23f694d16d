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
 * Gives a name to a table so that its outputs can be referred to as
 * {@code name.arg}.
 */
public final class AliasTable extends Table {

    private final Table table;
    private final String name;

    public AliasTable(SourceRange location, Table table, String name, ExpressionSignature schema) {
        super(location, schema);
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public AliasTable(Table table, String name) {
        this(null, table, name, table.schema());
    }

    public Table table() {
        return table;
    }

    public String name() {
        return name;
    }

    @Override
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return table.iterateSlots2(scope, into);
    }

    @Override
    public AliasTable clone() {
        return new AliasTable(location, table.clone(), name, cloneSchema());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAliasTable(this)) {
            table.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return parenthesize(table) + " as " + name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasTable)) return false;
        AliasTable that = (AliasTable) obj;
        return table.equals(that.table) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("alias", table, name);
    }

    @Override
    public String toString() {
        return "AliasTable(" + table + ", " + name + ")";
    }
}
