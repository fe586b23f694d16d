package com.thingtalk.slots;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What slot iteration of a node hands to the nodes evaluated after it: the
 * primitive that produced the results, and the names it makes available.
 *
 * @param primitive the last invocation, or null
 * @param scope the names available for parameter passing
 */
public record SlotScope(InvocationLike primitive, Map<String, ScopeEntry> scope) {

    private static final SlotScope EMPTY = new SlotScope(null, Collections.emptyMap());

    public SlotScope {
        Objects.requireNonNull(scope, "scope must not be null");
        scope = Collections.unmodifiableMap(new LinkedHashMap<>(scope));
    }

    public static SlotScope empty() {
        return EMPTY;
    }
}
