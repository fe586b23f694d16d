package com.thingtalk.types;

import java.util.Objects;

/**
 * Placeholder for a type name the type system does not recognize.
 *
 * <p>Unknown types are never assignable to or from any other type, so a
 * signature that mentions one fails type checking instead of being accepted
 * unsoundly.
 */
public final class UnknownType implements Type {

    private final String name;

    public UnknownType(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    @Override
    public String typeName() {
        return name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnknownType)) return false;
        return name.equals(((UnknownType) obj).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
