package com.thingtalk.schema;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.util.SourceFormat;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declaration of an entity type inside a class: {@code entity song extends album;}.
 *
 * <p>Entity names are local to the class; the full entity type is
 * {@code <class kind>:<name>}.
 */
public final class EntityDef extends Node {

    private final String name;
    private final List<String> extendsList;
    private final Map<String, Object> metadata;
    private final Map<String, Value> annotations;

    public EntityDef(SourceRange location, String name, List<String> extendsList,
                     Map<String, Object> metadata, Map<String, Value> annotations) {
        super(location);
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.extendsList = extendsList == null ? new ArrayList<>() : new ArrayList<>(extendsList);
        this.metadata = new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata must not be null"));
        this.annotations = new LinkedHashMap<>(Objects.requireNonNull(annotations, "annotations must not be null"));
    }

    public EntityDef(String name) {
        this(null, name, Collections.emptyList(), Collections.emptyMap(), Collections.emptyMap());
    }

    public String name() {
        return name;
    }

    public List<String> extendsList() {
        return Collections.unmodifiableList(extendsList);
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public Map<String, Value> annotations() {
        return annotations;
    }

    @Override
    public EntityDef clone() {
        Map<String, Value> impl = new LinkedHashMap<>();
        annotations.forEach((key, value) -> impl.put(key, value.clone()));
        return new EntityDef(location, name, extendsList, metadata, impl);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitEntityDef(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String parents = extendsList.isEmpty() ? "" : " extends " + String.join(", ", extendsList);
        return "entity " + name + parents + SourceFormat.annotations(metadata, annotations) + ";";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EntityDef)) return false;
        EntityDef that = (EntityDef) obj;
        return name.equals(that.name)
            && extendsList.equals(that.extendsList)
            && metadata.equals(that.metadata)
            && annotations.equals(that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, extendsList);
    }

    @Override
    public String toString() {
        return "EntityDef(" + name + ")";
    }
}
