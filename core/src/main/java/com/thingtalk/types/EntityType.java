package com.thingtalk.types;

import java.util.Objects;

/**
 * Type of entity values, identified by a namespaced entity name such as
 * {@code tt:email_address} or {@code com.spotify:song}.
 */
public final class EntityType implements Type {

    private final String entityName;

    public EntityType(String entityName) {
        this.entityName = Objects.requireNonNull(entityName, "entityName must not be null");
    }

    public String entityName() {
        return entityName;
    }

    @Override
    public String typeName() {
        return "Entity(" + entityName + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EntityType)) return false;
        return entityName.equals(((EntityType) obj).entityName);
    }

    @Override
    public int hashCode() {
        return entityName.hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
