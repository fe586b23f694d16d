package com.thingtalk.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Type of enumerated values.
 *
 * <p>The entry list may contain the wildcard {@code *}, which accepts any
 * entry. A null entry list denotes an enum whose entries are not yet known.
 */
public final class EnumType implements Type {

    private final List<String> entries;

    /**
     * Creates an enum type.
     *
     * @param entries the allowed entries, or null if unknown
     */
    public EnumType(List<String> entries) {
        this.entries = entries == null ? null : Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Returns the allowed entries.
     *
     * @return the entries, or null if unknown
     */
    public List<String> entries() {
        return entries;
    }

    /**
     * Returns whether the given entry is accepted by this enum.
     *
     * @param entry the entry
     * @return true if the entry is listed or the enum has a wildcard
     */
    public boolean accepts(String entry) {
        return entries == null || entries.contains("*") || entries.contains(entry);
    }

    @Override
    public String typeName() {
        if (entries == null) {
            return "Enum(*)";
        }
        return "Enum(" + String.join(",", entries) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EnumType)) return false;
        return Objects.equals(entries, ((EnumType) obj).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(entries);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
