package com.thingtalk.slots;

import com.thingtalk.ast.InputParam;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.types.Types;
import com.thingtalk.values.ArrayValue;
import com.thingtalk.values.ComputationValue;
import com.thingtalk.values.EventValue;
import com.thingtalk.values.Value;
import com.thingtalk.values.VarRefValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Building blocks shared by the {@code iterateSlots2} implementations of
 * the tree nodes.
 *
 * <p>Slot iteration appends items to a caller-provided list in evaluation
 * order and returns the {@link SlotScope} that later nodes see.
 */
public final class Slots {

    private static final Logger logger = LoggerFactory.getLogger(Slots.class);

    private Slots() {} // Utility class

    /**
     * Builds the scope produced by an invocation: one entry per output
     * argument of its schema, plus {@code $event}.
     *
     * @param invocation the invocation
     * @return the scope, empty if the invocation has no schema yet
     */
    public static Map<String, ScopeEntry> makeScope(InvocationLike invocation) {
        ExpressionSignature schema = invocation.schema();
        if (schema == null) {
            return Collections.emptyMap();
        }
        String kindCanonical = null;
        if (schema.classDef() != null) {
            Object canonical = schema.classDef().getNaturalLanguageAnnotation("canonical");
            kindCanonical = canonical instanceof String ? (String) canonical : null;
        }
        Map<String, ScopeEntry> scope = new LinkedHashMap<>();
        for (Map.Entry<String, Type> out : schema.out().entrySet()) {
            String name = out.getKey();
            scope.put(name, new ScopeEntry(new VarRefValue(name), out.getValue(), schema.getArgCanonical(name),
                invocation, invocation.selectorKind(), kindCanonical));
        }
        scope.put("$event", new ScopeEntry(new EventValue(null), PrimitiveType.STRING));
        return scope;
    }

    /**
     * Keeps only the named entries of a scope, in the given order.
     *
     * @param scope the scope
     * @param names the names to keep
     * @return the restricted scope
     */
    public static Map<String, ScopeEntry> restrictScope(Map<String, ScopeEntry> scope, List<String> names) {
        Map<String, ScopeEntry> restricted = new LinkedHashMap<>();
        for (String name : names) {
            ScopeEntry entry = scope.get(name);
            if (entry != null) {
                restricted.put(name, entry);
            }
        }
        return restricted;
    }

    /**
     * Merges two scopes; entries of the second win.
     *
     * @param first the first scope
     * @param second the second scope
     * @return the merged scope
     */
    public static Map<String, ScopeEntry> mergeScopes(Map<String, ScopeEntry> first, Map<String, ScopeEntry> second) {
        Map<String, ScopeEntry> merged = new LinkedHashMap<>(first);
        merged.putAll(second);
        return merged;
    }

    /**
     * Adds a slot, then one slot per element when its value is an array and
     * one per operand when it is a computation, recursively.
     *
     * @param slot the slot
     * @param into the list to append to
     */
    public static void recursiveYieldArraySlots(AbstractSlot slot, List<SlotItem> into) {
        into.add(slot);
        Value value = slot.get();
        if (value instanceof ArrayValue) {
            List<Value> elements = ((ArrayValue) value).values();
            Type elementType = Types.elementType(slot.type());
            for (int i = 0; i < elements.size(); i++) {
                recursiveYieldArraySlots(
                    new ArrayIndexSlot(slot.primitive(), slot.scope(), elementType, elements, slot, i), into);
            }
        } else if (value instanceof ComputationValue) {
            ComputationValue computation = (ComputationValue) value;
            List<Type> overload = computation.overload() == null
                ? Collections.emptyList() : computation.overload();
            if (overload.size() != computation.operands().size() + 1) {
                logger.warn("Missing overload on computation value: {}", computation.toSource());
            }
            for (int i = 0; i < computation.operands().size(); i++) {
                Type operandType = i < overload.size() ? overload.get(i) : PrimitiveType.ANY;
                recursiveYieldArraySlots(new ComputationOperandSlot(slot.primitive(), slot.scope(), operandType,
                    computation.op(), computation.operands(), slot, i), into);
            }
        }
    }

    /**
     * Adds one slot per input parameter of an invocation (with their array
     * and computation sub-slots) and returns the scope the invocation
     * produces.
     *
     * @param primitive the invocation
     * @param scope the names available to its parameters
     * @param into the list to append to
     * @return the invocation and its output scope
     */
    public static SlotScope iterateInputParams(InvocationLike primitive, Map<String, ScopeEntry> scope,
                                               List<SlotItem> into) {
        ExpressionSignature schema = primitive.schema();
        for (InputParam inParam : primitive.inParams()) {
            ArgumentDef arg = schema == null ? null : schema.getArgument(inParam.name());
            recursiveYieldArraySlots(new InputParamSlot(primitive, scope, arg, inParam), into);
        }
        return new SlotScope(primitive, makeScope(primitive));
    }
}
