package com.thingtalk.ast;

import com.thingtalk.slots.SlotItem;

import java.util.List;

/**
 * A top-level statement of a program.
 */
public abstract sealed class Statement extends Node permits Rule, Command, Assignment, Declaration {

    protected Statement(SourceRange location) {
        super(location);
    }

    @Override
    public abstract Statement clone();

    /**
     * Adds the slots of this statement in evaluation order. Statements
     * start from an empty scope.
     *
     * @param into the list to append to
     */
    public abstract void iterateSlots2(List<SlotItem> into);

    static <T extends Node> void requireActions(List<T> actions) {
        if (actions.isEmpty()) {
            throw new IllegalArgumentException("Statement must have at least one action");
        }
    }
}
