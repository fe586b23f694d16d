package com.thingtalk.slots;

import com.thingtalk.ast.InputParam;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.Names;
import com.thingtalk.values.Value;

import java.util.Map;
import java.util.Objects;

/**
 * The value of an input parameter bound at a call site.
 */
public final class InputParamSlot extends AbstractSlot {

    private final ArgumentDef arg;
    private final InputParam slot;

    public InputParamSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, ArgumentDef arg, InputParam slot) {
        super(primitive, scope);
        this.arg = arg;
        this.slot = Objects.requireNonNull(slot, "slot must not be null");
    }

    @Override
    public ArgumentDef arg() {
        return arg;
    }

    @Override
    public Type type() {
        return arg == null ? PrimitiveType.ANY : arg.type();
    }

    @Override
    public String tag() {
        return "in_param." + slot.name();
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
    public String argCanonical() {
        return arg == null ? Names.clean(slot.name()) : arg.canonical();
    }

    @Override
    public String toString() {
        return "InputParamSlot(" + slot.name() + " : " + type() + ")";
    }
}
