package com.thingtalk.slots;

import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.types.Type;
import com.thingtalk.values.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One element of a list of values, addressed by position. The parent is
 * either the slot holding the whole array, or a plain tag for lists that
 * are not themselves slots (the times of a timer, the indices of a table).
 */
public final class ArrayIndexSlot extends AbstractSlot {

    private final Type type;
    private final List<Value> array;
    private final AbstractSlot parent;
    private final String baseTag;
    private final int index;

    public ArrayIndexSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, Type type,
                          List<Value> array, AbstractSlot parent, int index) {
        this(primitive, scope, type, array, parent, parent.tag(), index);
    }

    public ArrayIndexSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, Type type,
                          List<Value> array, String baseTag, int index) {
        this(primitive, scope, type, array, null, baseTag, index);
    }

    private ArrayIndexSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, Type type,
                           List<Value> array, AbstractSlot parent, String baseTag, int index) {
        super(primitive, scope);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.array = Objects.requireNonNull(array, "array must not be null");
        this.parent = parent;
        this.baseTag = Objects.requireNonNull(baseTag, "baseTag must not be null");
        if (index < 0 || index >= array.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for " + baseTag);
        }
        this.index = index;
    }

    @Override
    public ArgumentDef arg() {
        return parent == null ? null : parent.arg();
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public String tag() {
        return baseTag + "." + index;
    }

    @Override
    public Value get() {
        return array.get(index);
    }

    @Override
    public void set(Value value) {
        array.set(index, Objects.requireNonNull(value, "value must not be null"));
    }

    @Override
    public String argCanonical() {
        return parent == null ? "" : parent.argCanonical();
    }

    @Override
    public String toString() {
        return "ArrayIndexSlot([" + index + "] : " + type + ")";
    }
}
