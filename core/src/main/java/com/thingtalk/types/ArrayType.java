package com.thingtalk.types;

import java.util.Objects;

/**
 * Type representing an ordered list of elements of the same type.
 *
 * <p>Example: {@code Array(Entity(tt:hashtag))}. Supports nesting.
 */
public final class ArrayType implements Type {

    private final Type elementType;

    /**
     * Creates an array type with the given element type.
     *
     * @param elementType the type of elements in the array
     */
    public ArrayType(Type elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    /**
     * Returns the element type.
     *
     * @return the element type
     */
    public Type elementType() {
        return elementType;
    }

    @Override
    public String typeName() {
        return "Array(" + elementType.typeName() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayType)) return false;
        return elementType.equals(((ArrayType) obj).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Array", elementType);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
