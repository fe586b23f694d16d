package com.thingtalk.types;

/**
 * Sealed interface for all types in the ThingTalk type system.
 *
 * <p>Types are immutable values compared structurally. They describe the
 * arguments of function signatures and the results of values and scalar
 * expressions.
 *
 * <p>Type families:
 * <ul>
 *   <li>Primitive types: Any, Boolean, String, Number, Currency, Time, Date, Location, ...</li>
 *   <li>Parameterized types: Entity(name), Measure(unit), Enum(entries)</li>
 *   <li>Composite types: Array(elem), Compound{fields}</li>
 *   <li>Unknown types, produced for names the type system does not know</li>
 * </ul>
 *
 * <p>{@link #toString()} returns the surface form accepted by {@link TypeParser#parse(String)}.
 */
public sealed interface Type
    permits PrimitiveType, EntityType, MeasureType, EnumType,
            ArrayType, CompoundType, UnknownType {

    /**
     * Returns the surface name of this type, e.g. {@code Entity(tt:url)}.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns whether this is the {@code Any} type.
     *
     * @return true for Any
     */
    default boolean isAny() {
        return this == PrimitiveType.ANY;
    }
}
