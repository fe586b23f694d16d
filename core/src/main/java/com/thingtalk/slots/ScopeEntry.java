package com.thingtalk.slots;

import com.thingtalk.types.Type;
import com.thingtalk.values.Value;

import java.util.Objects;

/**
 * A name available for parameter passing into a slot.
 *
 * @param value the value to pass (a variable reference or an event)
 * @param type the type of the value
 * @param argCanonical the display label of the output argument, or null
 * @param primitive the invocation that produces the value, or null
 * @param kind the device kind of that invocation, or null
 * @param kindCanonical the display name of the device class, or null
 */
public record ScopeEntry(Value value, Type type, String argCanonical,
                         InvocationLike primitive, String kind, String kindCanonical) {

    public ScopeEntry {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public ScopeEntry(Value value, Type type) {
        this(value, type, null, null, null, null);
    }
}
