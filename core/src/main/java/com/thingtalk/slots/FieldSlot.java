package com.thingtalk.slots;

import com.thingtalk.types.Type;
import com.thingtalk.values.Value;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A value held in a named field of a tree node, such as the limit of a
 * slice or the interval of a timer. The node exposes the field through a
 * getter and a setter.
 */
public final class FieldSlot extends AbstractSlot {

    private final Type type;
    private final String tag;
    private final String field;
    private final Supplier<Value> getter;
    private final Consumer<Value> setter;

    public FieldSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, Type type,
                     String baseTag, String field, Supplier<Value> getter, Consumer<Value> setter) {
        super(primitive, scope);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.tag = baseTag + "." + field;
        this.getter = Objects.requireNonNull(getter, "getter must not be null");
        this.setter = Objects.requireNonNull(setter, "setter must not be null");
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public Value get() {
        return getter.get();
    }

    @Override
    public void set(Value value) {
        setter.accept(Objects.requireNonNull(value, "value must not be null"));
    }

    @Override
    public String toString() {
        return "FieldSlot(" + field + " : " + type + ")";
    }
}
