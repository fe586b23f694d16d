package com.thingtalk.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Type without parameters.
 *
 * <p>Primitive types are interned: there is exactly one instance per name,
 * so identity comparison is sufficient.
 */
public final class PrimitiveType implements Type {

    private static final Map<String, PrimitiveType> BY_NAME = new LinkedHashMap<>();

    public static final PrimitiveType ANY = register("Any");
    public static final PrimitiveType BOOLEAN = register("Boolean");
    public static final PrimitiveType STRING = register("String");
    public static final PrimitiveType NUMBER = register("Number");
    public static final PrimitiveType CURRENCY = register("Currency");
    public static final PrimitiveType TIME = register("Time");
    public static final PrimitiveType DATE = register("Date");
    public static final PrimitiveType LOCATION = register("Location");
    public static final PrimitiveType RECURRENT_TIME_SPECIFICATION = register("RecurrentTimeSpecification");
    public static final PrimitiveType ARG_MAP = register("ArgMap");
    public static final PrimitiveType OBJECT = register("Object");

    private final String name;

    private PrimitiveType(String name) {
        this.name = name;
    }

    private static PrimitiveType register(String name) {
        PrimitiveType type = new PrimitiveType(name);
        BY_NAME.put(name, type);
        return type;
    }

    /**
     * Looks up a primitive type by its surface name.
     *
     * @param name the type name, e.g. "Number"
     * @return the interned type, or null if no primitive type has that name
     */
    public static PrimitiveType forName(String name) {
        return BY_NAME.get(name);
    }

    /**
     * Returns every primitive type, in declaration order.
     *
     * @return an unmodifiable view of the primitive types
     */
    public static Map<String, PrimitiveType> all() {
        return Collections.unmodifiableMap(BY_NAME);
    }

    @Override
    public String typeName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
