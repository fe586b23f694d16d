package com.thingtalk.logical;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;

import java.util.List;
import java.util.Map;

/**
 * Base class for the actions at the end of a rule or command.
 */
public abstract sealed class Action extends Node permits VarRefAction, InvocationAction {

    /** Signature of the called action, null before type checking */
    protected ExpressionSignature schema;

    protected Action(SourceRange location, ExpressionSignature schema) {
        super(location);
        this.schema = schema;
    }

    public ExpressionSignature schema() {
        return schema;
    }

    public void setSchema(ExpressionSignature schema) {
        this.schema = schema;
    }

    @Override
    public abstract Action clone();

    /**
     * Adds the slots of this action. Actions produce no scope.
     *
     * @param scope the names available for parameter passing
     * @param into the list to append to
     */
    public abstract void iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into);

    protected ExpressionSignature cloneSchema() {
        return schema == null ? null : schema.clone();
    }
}
