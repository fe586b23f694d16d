package com.thingtalk.slots;

import com.thingtalk.ast.InputParam;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.values.Value;

import java.util.Collections;
import java.util.Objects;

/**
 * An attribute used to pick a device when no device id is known. Only the
 * {@code name} attribute is supported. Nothing can be passed into it, so its
 * scope is empty.
 */
public final class DeviceAttributeSlot extends AbstractSlot {

    private final InputParam slot;

    public DeviceAttributeSlot(InvocationLike primitive, InputParam attribute) {
        super(primitive, Collections.emptyMap());
        this.slot = Objects.requireNonNull(attribute, "attribute must not be null");
        if (!"name".equals(attribute.name())) {
            throw new IllegalArgumentException("Unsupported device attribute " + attribute.name());
        }
    }

    @Override
    public Type type() {
        return PrimitiveType.STRING;
    }

    @Override
    public String tag() {
        return "attribute." + slot.name();
    }

    @Override
    public Value get() {
        return slot.value();
    }

    @Override
    public void set(Value value) {
        slot.setValue(value);
    }

    @Override
    public String toString() {
        return "DeviceAttributeSlot(" + slot.name() + " : " + type() + ")";
    }
}
