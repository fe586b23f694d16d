package com.thingtalk.ast;

import com.thingtalk.logical.Action;
import com.thingtalk.logical.Stream;
import com.thingtalk.logical.Table;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.types.Type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code let query name(p_x : String) := @com.example.get(x=p_x);}: names
 * a stream, query, action, program or procedure so later statements can
 * refer to it.
 *
 * <p>The declared kind fixes the node family of the value: a Stream for
 * {@code stream}, a Table for {@code query}, an Action for {@code action}
 * and a Program for {@code program} and {@code procedure}.
 */
public final class Declaration extends Statement {

    private final String name;
    private final String type;
    private final Map<String, Type> args;
    private final Node value;

    /**
     * @param location the source location, or null
     * @param name the declared name
     * @param type stream, query, action, program or procedure
     * @param args the declared parameters, in order
     * @param value the declared body
     * @throws IllegalArgumentException if the type is unknown or the value
     *         does not match it
     */
    public Declaration(SourceRange location, String name, String type, Map<String, Type> args, Node value) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(args, "args must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        checkValue(type, value);
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public Declaration(String name, String type, Map<String, Type> args, Node value) {
        this(null, name, type, args, value);
    }

    private static void checkValue(String type, Node value) {
        boolean ok;
        switch (type) {
            case "stream":
                ok = value instanceof Stream;
                break;
            case "query":
                ok = value instanceof Table;
                break;
            case "action":
                ok = value instanceof Action;
                break;
            case "program":
            case "procedure":
                ok = value instanceof Program;
                break;
            default:
                throw new IllegalArgumentException("Invalid declaration type: " + type);
        }
        if (!ok) {
            throw new IllegalArgumentException("Declaration of type " + type + " cannot hold "
                + value.getClass().getSimpleName());
        }
    }

    public String name() {
        return name;
    }

    public String type() {
        return type;
    }

    public Map<String, Type> args() {
        return args;
    }

    public Node value() {
        return value;
    }

    // programs and procedures are filled in where they are called
    @Override
    public void iterateSlots2(List<SlotItem> into) {
        if (value instanceof Stream) {
            ((Stream) value).iterateSlots2(Collections.emptyMap(), into);
        } else if (value instanceof Table) {
            ((Table) value).iterateSlots2(Collections.emptyMap(), into);
        } else if (value instanceof Action) {
            ((Action) value).iterateSlots2(Collections.emptyMap(), into);
        }
    }

    @Override
    public Declaration clone() {
        return new Declaration(location, name, type, args, value.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitDeclaration(this)) {
            value.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        StringBuilder sb = new StringBuilder("let ").append(type).append(' ').append(name).append('(');
        boolean first = true;
        for (Map.Entry<String, Type> arg : args.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(arg.getKey()).append(" : ").append(arg.getValue());
            first = false;
        }
        sb.append(") := ");
        if (value instanceof Program) {
            sb.append("{\n").append(value.toSource()).append("\n}");
        } else {
            sb.append(value.toSource());
        }
        return sb.append(';').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Declaration)) return false;
        Declaration that = (Declaration) obj;
        return name.equals(that.name)
            && type.equals(that.type)
            && args.equals(that.args)
            && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("declaration", name, type, args);
    }

    @Override
    public String toString() {
        return "Declaration(" + type + " " + name + ", " + args + ", " + value + ")";
    }
}
