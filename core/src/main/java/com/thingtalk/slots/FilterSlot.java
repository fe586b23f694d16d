package com.thingtalk.slots;

import com.thingtalk.expression.AtomBooleanExpression;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.types.Types;
import com.thingtalk.util.Names;
import com.thingtalk.values.EventValue;
import com.thingtalk.values.Value;
import com.thingtalk.values.VarRefValue;

import java.util.Map;
import java.util.Objects;

/**
 * The right-hand side of a filter atom ({@code name op value}).
 *
 * <p>The slot type depends on the operator: {@code contains} expects an
 * element of the array argument, {@code in_array} an array of the argument
 * type, and the fuzzy string operators a String.
 */
public final class FilterSlot extends AbstractSlot {

    private final ArgumentDef arg;
    private final AtomBooleanExpression filter;

    public FilterSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, ArgumentDef arg,
                      AtomBooleanExpression filter) {
        super(primitive, scope);
        this.arg = arg;
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    @Override
    public ArgumentDef arg() {
        return arg;
    }

    @Override
    public Type type() {
        if (arg == null) {
            return PrimitiveType.ANY;
        }
        switch (filter.operator()) {
            case "contains":
                return Types.elementType(arg.type());
            case "contains~":
            case "~contains":
            case "~in_array":
                return PrimitiveType.STRING;
            case "in_array":
                return new ArrayType(arg.type());
            case "in_array~":
                return new ArrayType(PrimitiveType.STRING);
            default:
                return arg.type();
        }
    }

    // "x == x" on the same invocation, and events, are never useful options
    @Override
    protected boolean acceptsOption(ScopeEntry option) {
        if (option.value() instanceof VarRefValue
            && ((VarRefValue) option.value()).name().equals(filter.name())
            && option.primitive() == primitive()) {
            return false;
        }
        return !(option.value() instanceof EventValue);
    }

    @Override
    public String tag() {
        return "filter." + filter.operator() + "." + filter.name();
    }

    @Override
    public Value get() {
        return filter.value();
    }

    @Override
    public void set(Value value) {
        filter.setValue(value);
    }

    @Override
    public String argCanonical() {
        return arg == null ? Names.clean(filter.name()) : arg.canonical();
    }

    @Override
    public String toString() {
        return "FilterSlot(" + filter.name() + " " + filter.operator() + " : " + type() + ")";
    }
}
