package com.thingtalk.ast;

import com.thingtalk.logical.Table;
import com.thingtalk.slots.SlotItem;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code let result name := table;}: evaluates a query once and stores its
 * results under a name.
 */
public final class Assignment extends Statement {

    private final String name;
    private final Table value;

    public Assignment(SourceRange location, String name, Table value) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public Assignment(String name, Table value) {
        this(null, name, value);
    }

    public String name() {
        return name;
    }

    public Table value() {
        return value;
    }

    @Override
    public void iterateSlots2(List<SlotItem> into) {
        value.iterateSlots2(Collections.emptyMap(), into);
    }

    @Override
    public Assignment clone() {
        return new Assignment(location, name, value.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitAssignment(this)) {
            value.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return "let result " + name + " := " + value.toSource() + ";";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Assignment)) return false;
        Assignment that = (Assignment) obj;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("assignment", name, value);
    }

    @Override
    public String toString() {
        return "Assignment(" + name + ", " + value + ")";
    }
}
