package com.thingtalk.ast;

import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.List;
import java.util.Map;

/**
 * The query or action part of a permission rule: which functions the rule
 * applies to, and under which conditions.
 */
public abstract sealed class PermissionFunction extends Node
    permits SpecifiedPermissionFunction, BuiltinPermissionFunction,
            ClassStarPermissionFunction, StarPermissionFunction {

    protected PermissionFunction(SourceRange location) {
        super(location);
    }

    @Override
    public abstract PermissionFunction clone();

    /**
     * Adds the slots of this permission function. Only specified functions
     * have slots or produce a scope.
     *
     * @param scope the names available to the filter
     * @param into the list to append to
     * @return the function and its output scope
     */
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        return SlotScope.empty();
    }
}
