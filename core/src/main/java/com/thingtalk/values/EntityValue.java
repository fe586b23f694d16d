package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entity constant: an opaque identifier of a given entity type plus an
 * optional display name.
 *
 * <p>An entity with a null identifier is known only by its display name
 * (for example a song mentioned by title) and must be resolved before the
 * program is compiled. Equality compares identifier and type; the display
 * name is presentational.
 */
public final class EntityValue extends Value {

    private final String value;
    private final String type;
    private final String display;

    /**
     * Creates an entity value.
     *
     * @param location the source location, or null
     * @param value the entity identifier, or null if unresolved
     * @param type the entity type, e.g. {@code tt:email_address}
     * @param display the display name, or null
     */
    public EntityValue(SourceRange location, String value, String type, String display) {
        super(location);
        this.value = value;
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.display = display;
    }

    public EntityValue(String value, String type, String display) {
        this(null, value, type, display);
    }

    public String value() {
        return value;
    }

    public String type() {
        return type;
    }

    public String display() {
        return display;
    }

    @Override
    public Type getType() {
        return new EntityType(type);
    }

    @Override
    public boolean isConcrete() {
        return value != null;
    }

    @Override
    public Object toJS() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("value", value);
        result.put("display", display);
        return result;
    }

    @Override
    public EntityValue clone() {
        return new EntityValue(location, value, type, display);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitEntityValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String id = value == null ? "null" : SourceFormat.quote(value);
        if (display != null) {
            return id + "^^" + type + "(" + SourceFormat.quote(display) + ")";
        }
        return id + "^^" + type;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EntityValue)) return false;
        EntityValue that = (EntityValue) obj;
        return Objects.equals(value, that.value) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, type);
    }

    @Override
    public String toString() {
        return "Entity(" + value + ", " + type + ", " + display + ")";
    }
}
