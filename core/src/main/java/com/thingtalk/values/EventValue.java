package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.NotConstantException;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.util.Objects;

/**
 * Reference to the event that triggered the current rule: {@code $event}
 * (its textual description) or one of its properties such as
 * {@code $event.type}.
 */
public final class EventValue extends Value {

    private final String name;

    /**
     * Creates an event reference.
     *
     * @param location the source location, or null
     * @param name the event property ("type", "program_id", "source"), or null for the whole event
     */
    public EventValue(SourceRange location, String name) {
        super(location);
        this.name = name;
    }

    public EventValue(String name) {
        this(null, name);
    }

    public String name() {
        return name;
    }

    @Override
    public Type getType() {
        if (name == null) {
            return PrimitiveType.STRING;
        }
        switch (name) {
            case "type":
                return new EntityType("tt:function");
            case "program_id":
                return new EntityType("tt:program_id");
            case "source":
                return new EntityType("tt:contact");
            default:
                return PrimitiveType.STRING;
        }
    }

    @Override
    public boolean isConstant() {
        return false;
    }

    @Override
    public Object toJS() {
        throw new NotConstantException(toSource());
    }

    @Override
    public EventValue clone() {
        return new EventValue(location, name);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitEventValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return name == null ? "$event" : "$event." + name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EventValue)) return false;
        return Objects.equals(name, ((EventValue) obj).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Event", name);
    }

    @Override
    public String toString() {
        return "Event(" + name + ")";
    }
}
