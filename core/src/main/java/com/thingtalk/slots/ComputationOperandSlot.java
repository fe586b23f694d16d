package com.thingtalk.slots;

import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.types.Type;
import com.thingtalk.values.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One operand of a computation such as {@code distance(here, $?)}.
 */
public final class ComputationOperandSlot extends AbstractSlot {

    private final Type type;
    private final String operator;
    private final List<Value> operands;
    private final AbstractSlot parent;
    private final int index;

    public ComputationOperandSlot(InvocationLike primitive, Map<String, ScopeEntry> scope, Type type,
                                  String operator, List<Value> operands, AbstractSlot parent, int index) {
        super(primitive, scope);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operands = Objects.requireNonNull(operands, "operands must not be null");
        this.parent = Objects.requireNonNull(parent, "parent must not be null");
        this.index = index;
    }

    @Override
    public ArgumentDef arg() {
        return parent.arg();
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public String tag() {
        return parent.tag() + "." + operator + "." + index;
    }

    @Override
    public Value get() {
        return operands.get(index);
    }

    @Override
    public void set(Value value) {
        operands.set(index, Objects.requireNonNull(value, "value must not be null"));
    }

    @Override
    public String argCanonical() {
        return parent.argCanonical();
    }

    @Override
    public String toString() {
        return "ComputationOperandSlot(" + operator + "[" + index + "] : " + type + ")";
    }
}
