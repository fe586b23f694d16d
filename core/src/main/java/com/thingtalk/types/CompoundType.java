package com.thingtalk.types;

import com.thingtalk.schema.ArgumentDef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured type whose fields are themselves argument definitions.
 *
 * <p>Field order is preserved. Fields of a compound used as a function
 * argument take the direction of that argument.
 *
 * <p>Two compound types are equal when they have the same name and the same
 * field names mapped to equal field types.
 */
public final class CompoundType implements Type {

    private final String name;
    private final Map<String, ArgumentDef> fields;

    /**
     * Creates a compound type.
     *
     * @param name the declared name, or null for anonymous compounds
     * @param fields the fields, keyed by field name
     */
    public CompoundType(String name, Map<String, ArgumentDef> fields) {
        this.name = name;
        Objects.requireNonNull(fields, "fields must not be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String name() {
        return name;
    }

    /**
     * Returns the fields of this compound, in declaration order.
     *
     * @return an unmodifiable map of fields
     */
    public Map<String, ArgumentDef> fields() {
        return fields;
    }

    @Override
    public String typeName() {
        return name == null ? "Compound" : "Compound(" + name + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CompoundType)) return false;
        CompoundType that = (CompoundType) obj;
        if (!Objects.equals(name, that.name)) return false;
        if (!fields.keySet().equals(that.fields.keySet())) return false;
        for (Map.Entry<String, ArgumentDef> entry : fields.entrySet()) {
            if (!entry.getValue().type().equals(that.fields.get(entry.getKey()).type())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields.keySet());
    }

    @Override
    public String toString() {
        return typeName();
    }
}
