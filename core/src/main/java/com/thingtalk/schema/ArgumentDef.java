package com.thingtalk.schema;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.CompoundType;
import com.thingtalk.types.Type;
import com.thingtalk.util.Names;
import com.thingtalk.util.SourceFormat;
import com.thingtalk.values.BooleanValue;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Definition of a function argument: direction, name, type and annotations.
 *
 * <p>The same class describes the fields of a {@link CompoundType}. Fields
 * have no direction of their own; when a compound (or an array of compounds)
 * is used as a function argument, its fields are rebuilt with the direction of
 * that argument, recursively. The type passed in is never modified.
 *
 * <p>A null direction counts as a required input.
 */
public final class ArgumentDef extends Node {

    private final ArgDirection direction;
    private final String name;
    private final Type type;
    private final Map<String, Object> metadata;
    private final Map<String, Value> annotations;
    private final boolean compoundField;

    /**
     * Creates an argument definition.
     *
     * @param location the source location, or null
     * @param direction the direction, or null for a compound field
     * @param name the argument name
     * @param type the argument type
     * @param metadata natural-language annotations ({@code #_[...]})
     * @param annotations implementation annotations ({@code #[...]})
     */
    public ArgumentDef(SourceRange location, ArgDirection direction, String name, Type type,
                       Map<String, Object> metadata, Map<String, Value> annotations) {
        this(location, direction, name, type, metadata, annotations, direction == null);
    }

    public ArgumentDef(ArgDirection direction, String name, Type type) {
        this(null, direction, name, type, Collections.emptyMap(), Collections.emptyMap());
    }

    private ArgumentDef(SourceRange location, ArgDirection direction, String name, Type type,
                        Map<String, Object> metadata, Map<String, Value> annotations,
                        boolean compoundField) {
        super(location);
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(annotations, "annotations must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Argument name must not be empty");
        }
        this.direction = direction;
        this.name = name;
        this.type = direction == null ? type : propagateDirection(type, direction);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.compoundField = compoundField;
    }

    private static Type propagateDirection(Type type, ArgDirection direction) {
        if (type instanceof CompoundType) {
            CompoundType compound = (CompoundType) type;
            Map<String, ArgumentDef> fields = new LinkedHashMap<>();
            for (Map.Entry<String, ArgumentDef> entry : compound.fields().entrySet()) {
                fields.put(entry.getKey(), entry.getValue().asField(direction));
            }
            return new CompoundType(compound.name(), fields);
        }
        if (type instanceof ArrayType && ((ArrayType) type).elementType() instanceof CompoundType) {
            return new ArrayType(propagateDirection(((ArrayType) type).elementType(), direction));
        }
        return type;
    }

    private ArgumentDef asField(ArgDirection parentDirection) {
        return new ArgumentDef(location, parentDirection, name, type, metadata, annotations, true);
    }

    // ==================== Accessors ====================

    public ArgDirection direction() {
        return direction;
    }

    public String name() {
        return name;
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the natural-language annotations (canonical, prompt, ...).
     *
     * @return an unmodifiable map
     */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Returns the implementation annotations.
     *
     * @return an unmodifiable map
     */
    public Map<String, Value> annotations() {
        return annotations;
    }

    public boolean isInput() {
        return direction == null || direction != ArgDirection.OUT;
    }

    public boolean isRequired() {
        return direction == null || direction == ArgDirection.IN_REQ;
    }

    public boolean isCompoundField() {
        return compoundField;
    }

    /**
     * Returns whether the {@code unique} annotation is set to true.
     *
     * @return true if the argument uniquely identifies a result
     */
    public boolean isUnique() {
        Value unique = annotations.get("unique");
        return unique instanceof BooleanValue && ((BooleanValue) unique).value();
    }

    /**
     * Returns the display label of this argument.
     *
     * <p>This is the {@code canonical} annotation when it is a string. When it
     * is a map of phrases by part of speech, the first {@code base}, then
     * {@code property}, then {@code npp} phrase is used. Otherwise the label
     * is derived from the name.
     *
     * @return the canonical form, never null
     */
    public String canonical() {
        Object canonical = metadata.get("canonical");
        if (canonical instanceof String) {
            return (String) canonical;
        }
        if (canonical instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) canonical;
            for (String key : new String[] { "base", "property", "npp" }) {
                if (map.containsKey(key)) {
                    return firstPhrase(map.get(key));
                }
            }
        }
        return Names.clean(name);
    }

    private static String firstPhrase(Object phrases) {
        if (phrases instanceof List && !((List<?>) phrases).isEmpty()) {
            return String.valueOf(((List<?>) phrases).get(0));
        }
        return String.valueOf(phrases);
    }

    /**
     * Reads an implementation annotation, converted to a plain Java object.
     *
     * @param key the annotation name
     * @return the annotation value, or null if absent
     */
    public Object getImplementationAnnotation(String key) {
        Value value = annotations.get(key);
        return value == null ? null : value.toJS();
    }

    /**
     * Reads a natural-language annotation.
     *
     * @param key the annotation name
     * @return the annotation value, or null if absent
     */
    public Object getNaturalLanguageAnnotation(String key) {
        return metadata.get(key);
    }

    // ==================== Derived definitions ====================

    /**
     * Returns a copy of this argument under a different name.
     *
     * @param newName the new name
     * @return the renamed argument
     */
    public ArgumentDef withName(String newName) {
        return new ArgumentDef(location, direction, newName, type, metadata, annotations, compoundField);
    }

    /**
     * Returns a copy of this argument with a different direction.
     *
     * @param newDirection the new direction
     * @return the new argument
     */
    public ArgumentDef withDirection(ArgDirection newDirection) {
        return new ArgumentDef(location, newDirection, name, type, metadata, annotations, compoundField);
    }

    @Override
    public ArgumentDef clone() {
        Map<String, Value> impl = new LinkedHashMap<>();
        annotations.forEach((key, value) -> impl.put(key, value.clone()));
        return new ArgumentDef(location, direction, name, type, metadata, impl, compoundField);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitArgumentDef(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        StringBuilder sb = new StringBuilder();
        if (direction != null && !compoundField) {
            sb.append(direction.keyword()).append(' ');
        }
        sb.append(name).append(": ").append(typeSource(type));
        sb.append(SourceFormat.annotations(metadata, annotations));
        return sb.toString();
    }

    /**
     * Prints a type, spelling out the fields of compound types.
     *
     * @param type the type
     * @return the type in surface syntax
     */
    static String typeSource(Type type) {
        if (type instanceof CompoundType) {
            List<String> fields = new ArrayList<>();
            for (ArgumentDef field : ((CompoundType) type).fields().values()) {
                fields.add(field.toSource());
            }
            return "{ " + String.join(", ", fields) + " }";
        }
        if (type instanceof ArrayType) {
            return "Array(" + typeSource(((ArrayType) type).elementType()) + ")";
        }
        return type.typeName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArgumentDef)) return false;
        ArgumentDef that = (ArgumentDef) obj;
        return direction == that.direction
            && name.equals(that.name)
            && type.equals(that.type)
            && metadata.equals(that.metadata)
            && annotations.equals(that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, name, type);
    }

    @Override
    public String toString() {
        return "ArgumentDef(" + (direction == null ? "" : direction.keyword() + " ") + name + ": " + type + ")";
    }
}
