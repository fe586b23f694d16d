package com.thingtalk.ast;

import com.thingtalk.logical.Action;
import com.thingtalk.logical.Table;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code now => table => action;} or {@code now => action;}: runs the
 * actions once, on every result of the optional table.
 */
public final class Command extends Statement {

    private final Table table;
    private final List<Action> actions;

    /**
     * @param location the source location, or null
     * @param table the query whose results feed the actions, or null
     * @param actions the actions, at least one
     */
    public Command(SourceRange location, Table table, List<Action> actions) {
        super(location);
        this.table = table;
        Objects.requireNonNull(actions, "actions must not be null");
        requireActions(actions);
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    }

    public Command(Table table, List<Action> actions) {
        this(null, table, actions);
    }

    public Table table() {
        return table;
    }

    public List<Action> actions() {
        return actions;
    }

    @Override
    public void iterateSlots2(List<SlotItem> into) {
        Map<String, ScopeEntry> scope = Collections.emptyMap();
        if (table != null) {
            scope = table.iterateSlots2(scope, into).scope();
        }
        for (Action action : actions) {
            action.iterateSlots2(scope, into);
        }
    }

    @Override
    public Command clone() {
        List<Action> copy = new ArrayList<>(actions.size());
        for (Action action : actions) {
            copy.add(action.clone());
        }
        return new Command(location, table == null ? null : table.clone(), copy);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitCommand(this)) {
            if (table != null) {
                table.visit(visitor);
            }
            for (Action action : actions) {
                action.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String query = table == null ? "" : table.toSource() + " => ";
        return "now => " + query + SourceFormat.join(actions, Action::toSource, ", ") + ";";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Command)) return false;
        Command that = (Command) obj;
        return Objects.equals(table, that.table) && actions.equals(that.actions);
    }

    @Override
    public int hashCode() {
        return Objects.hash("command", table, actions);
    }

    @Override
    public String toString() {
        return "Command(" + table + ", " + actions + ")";
    }
}
