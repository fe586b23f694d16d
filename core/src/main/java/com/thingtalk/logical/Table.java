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
 * Base class for query expressions.
 *
 * <p>A table produces zero or more results, each a record of the output
 * arguments described by its schema. The schema is null until the table has
 * been type-checked.
 *
 * <p>Equality is structural and does not compare schemas.
 */
public abstract sealed class Table extends Node
    permits VarRefTable, InvocationTable, FilteredTable, ProjectionTable, ComputeTable,
            AliasTable, AggregationTable, SortedTable, IndexTable, SlicedTable, JoinTable,
            WindowTable, TimeSeriesTable, SequenceTable, HistoryTable {

    /** Output signature, null before type checking */
    protected ExpressionSignature schema;

    protected Table(SourceRange location, ExpressionSignature schema) {
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
    public abstract Table clone();

    /**
     * Adds the slots of this table in evaluation order.
     *
     * @param scope the names available for parameter passing
     * @param into the list to append to
     * @return the innermost invocation and the scope this table produces
     */
    public abstract SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into);

    protected ExpressionSignature cloneSchema() {
        return schema == null ? null : schema.clone();
    }

    static String parenthesize(Node node) {
        return "(" + node.toSource() + ")";
    }
}
