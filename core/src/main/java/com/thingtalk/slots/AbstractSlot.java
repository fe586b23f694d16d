package com.thingtalk.slots;

import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.Type;
import com.thingtalk.types.Types;
import com.thingtalk.values.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fillable value position in a program.
 *
 * <p>A slot reads and replaces the value it points to in the tree, knows
 * the type the value must have, and carries the scope of names a value
 * could be passed from. The tag identifies the kind of position
 * ({@code in_param.<name>}, {@code filter.<op>.<name>}, ...).
 */
public abstract class AbstractSlot implements SlotItem {

    private final InvocationLike primitive;
    protected final Map<String, ScopeEntry> scope;
    private List<ScopeEntry> options;

    protected AbstractSlot(InvocationLike primitive, Map<String, ScopeEntry> scope) {
        this.primitive = primitive;
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    /**
     * Returns the invocation this slot belongs to.
     *
     * @return the primitive, or null for slots outside any invocation
     */
    public InvocationLike primitive() {
        return primitive;
    }

    /**
     * Returns the function argument this slot fills.
     *
     * @return the argument, or null if unknown or not applicable
     */
    public ArgumentDef arg() {
        return null;
    }

    public Map<String, ScopeEntry> scope() {
        return scope;
    }

    /**
     * Returns the scope entries whose type can be assigned to this slot.
     * Computed on first use.
     *
     * @return the options, in scope order
     */
    public List<ScopeEntry> options() {
        if (options == null) {
            List<ScopeEntry> result = new ArrayList<>();
            Type slotType = type();
            for (ScopeEntry option : scope.values()) {
                if (Types.isAssignable(option.type(), slotType) && acceptsOption(option)) {
                    result.add(option);
                }
            }
            options = Collections.unmodifiableList(result);
        }
        return options;
    }

    protected boolean acceptsOption(ScopeEntry option) {
        return true;
    }

    public abstract Type type();

    public abstract String tag();

    public abstract Value get();

    public abstract void set(Value value);

    /**
     * Returns the display label of the argument behind this slot.
     *
     * @return the label, empty if there is none
     */
    public String argCanonical() {
        return "";
    }

    public boolean isUndefined() {
        return get().isUndefined();
    }

    public boolean isConcrete() {
        return get().isConcrete();
    }

    /**
     * Returns whether the current value can be compiled: it is defined,
     * concrete, and not a username where another entity type is expected.
     *
     * @return true if compilable
     */
    public boolean isCompilable() {
        Value value = get();
        if (value.isUndefined() || !value.isConcrete()) {
            return false;
        }
        Type valueType = value.getType();
        Type slotType = type();
        if (valueType instanceof EntityType && slotType instanceof EntityType) {
            String valueEntity = ((EntityType) valueType).entityName();
            String slotEntity = ((EntityType) slotType).entityName();
            return !("tt:username".equals(valueEntity) && !"tt:username".equals(slotEntity));
        }
        return true;
    }
}
