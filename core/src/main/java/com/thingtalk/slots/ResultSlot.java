package com.thingtalk.slots;

import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.types.Type;
import com.thingtalk.util.Names;
import com.thingtalk.values.Value;

import java.util.Map;
import java.util.Objects;

/**
 * One field of a result row returned by a query, keyed by argument name.
 */
public final class ResultSlot extends AbstractSlot {

    private final ArgumentDef arg;
    private final Map<String, Value> object;
    private final String key;

    public ResultSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, ArgumentDef arg,
                      Map<String, Value> object, String key) {
        super(primitive, scope);
        this.arg = arg;
        this.object = Objects.requireNonNull(object, "object must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
    }

    @Override
    public ArgumentDef arg() {
        return arg;
    }

    @Override
    public Type type() {
        return arg == null ? get().getType() : arg.type();
    }

    @Override
    public String tag() {
        return "result." + key;
    }

    @Override
    public Value get() {
        return object.get(key);
    }

    @Override
    public void set(Value value) {
        object.put(key, value);
    }

    @Override
    public String argCanonical() {
        return arg == null ? Names.clean(key) : arg.canonical();
    }

    @Override
    public String toString() {
        return "ResultSlot(" + key + " : " + type() + ")";
    }
}
