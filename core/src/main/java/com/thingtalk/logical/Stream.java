package com.thingtalk.logical;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;

import java.util.List;
import java.util.Map;

/**
 * Base class for stream expressions: sources of events over time, such as
 * timers or the changes of a monitored query.
 *
 * <p>Equality is structural and does not compare schemas.
 */
public abstract sealed class Stream extends Node
    permits VarRefStream, TimerStream, AtTimerStream, MonitorStream, EdgeNewStream,
            EdgeFilterStream, FilteredStream, ProjectionStream, ComputeStream,
            AliasStream, JoinStream {

    /** Output signature, null before type checking */
    protected ExpressionSignature schema;

    protected Stream(SourceRange location, ExpressionSignature schema) {
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
    public abstract Stream clone();

    /**
     * Adds the slots of this stream in evaluation order.
     *
     * @param scope the names available for parameter passing
     * @param into the list to append to
     * @return the innermost invocation and the scope each event produces
     */
    public abstract SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into);

    protected ExpressionSignature cloneSchema() {
        return schema == null ? null : schema.clone();
    }
}
