package com.thingtalk.ast;

import com.thingtalk.expression.AggregationScalarExpression;
import com.thingtalk.expression.AndBooleanExpression;
import com.thingtalk.expression.AtomBooleanExpression;
import com.thingtalk.expression.ComputeBooleanExpression;
import com.thingtalk.expression.DerivedScalarExpression;
import com.thingtalk.expression.DontCareBooleanExpression;
import com.thingtalk.expression.ExternalBooleanExpression;
import com.thingtalk.expression.FalseBooleanExpression;
import com.thingtalk.expression.NotBooleanExpression;
import com.thingtalk.expression.OrBooleanExpression;
import com.thingtalk.expression.PrimaryScalarExpression;
import com.thingtalk.expression.TrueBooleanExpression;
import com.thingtalk.expression.VarRefScalarExpression;
import com.thingtalk.logical.AggregationTable;
import com.thingtalk.logical.AliasStream;
import com.thingtalk.logical.AliasTable;
import com.thingtalk.logical.AtTimerStream;
import com.thingtalk.logical.ComputeStream;
import com.thingtalk.logical.ComputeTable;
import com.thingtalk.logical.EdgeFilterStream;
import com.thingtalk.logical.EdgeNewStream;
import com.thingtalk.logical.FilteredStream;
import com.thingtalk.logical.FilteredTable;
import com.thingtalk.logical.HistoryTable;
import com.thingtalk.logical.IndexTable;
import com.thingtalk.logical.InvocationAction;
import com.thingtalk.logical.InvocationTable;
import com.thingtalk.logical.JoinStream;
import com.thingtalk.logical.JoinTable;
import com.thingtalk.logical.MonitorStream;
import com.thingtalk.logical.ProjectionStream;
import com.thingtalk.logical.ProjectionTable;
import com.thingtalk.logical.SequenceTable;
import com.thingtalk.logical.SlicedTable;
import com.thingtalk.logical.SortedTable;
import com.thingtalk.logical.TimeSeriesTable;
import com.thingtalk.logical.TimerStream;
import com.thingtalk.logical.VarRefAction;
import com.thingtalk.logical.VarRefStream;
import com.thingtalk.logical.VarRefTable;
import com.thingtalk.logical.WindowTable;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.ClassDef;
import com.thingtalk.schema.EntityDef;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.schema.FunctionDef;
import com.thingtalk.schema.MixinImport;
import com.thingtalk.values.ArgMapValue;
import com.thingtalk.values.ArrayFieldValue;
import com.thingtalk.values.ArrayValue;
import com.thingtalk.values.BooleanValue;
import com.thingtalk.values.ComputationValue;
import com.thingtalk.values.ContextRefValue;
import com.thingtalk.values.CurrencyValue;
import com.thingtalk.values.DateValue;
import com.thingtalk.values.EntityValue;
import com.thingtalk.values.EnumValue;
import com.thingtalk.values.EventValue;
import com.thingtalk.values.FilterValue;
import com.thingtalk.values.LocationValue;
import com.thingtalk.values.MeasureValue;
import com.thingtalk.values.NullValue;
import com.thingtalk.values.NumberValue;
import com.thingtalk.values.ObjectValue;
import com.thingtalk.values.RecurrentTimeSpecificationValue;
import com.thingtalk.values.StringValue;
import com.thingtalk.values.TimeValue;
import com.thingtalk.values.UndefinedValue;
import com.thingtalk.values.VarRefValue;

/**
 * Traversal callbacks for {@link Node#visit(NodeVisitor)}.
 *
 * <p>Every node calls {@link #enter(Node)}, then the {@code visitXxx}
 * method of its variant, then {@link #exit(Node)}. Children are visited
 * only when {@code visitXxx} returns true, which is the default. Subclasses
 * override the methods for the nodes they care about.
 *
 * <p>Example, collecting the kinds of all invoked devices:
 * <pre>
 *   Set&lt;String&gt; kinds = new LinkedHashSet&lt;&gt;();
 *   program.visit(new NodeVisitor() {
 *       {@literal @}Override
 *       public boolean visitDeviceSelector(DeviceSelector selector) {
 *           kinds.add(selector.kind());
 *           return true;
 *       }
 *   });
 * </pre>
 */
public abstract class NodeVisitor {

    /**
     * Called before a node is visited.
     *
     * @param node the node
     */
    public void enter(Node node) {
    }

    /**
     * Called after a node and its children have been visited.
     *
     * @param node the node
     */
    public void exit(Node node) {
    }

    // ==================== Values ====================

    public boolean visitBooleanValue(BooleanValue node) {
        return true;
    }

    public boolean visitStringValue(StringValue node) {
        return true;
    }

    public boolean visitNumberValue(NumberValue node) {
        return true;
    }

    public boolean visitCurrencyValue(CurrencyValue node) {
        return true;
    }

    public boolean visitEntityValue(EntityValue node) {
        return true;
    }

    public boolean visitMeasureValue(MeasureValue node) {
        return true;
    }

    public boolean visitEnumValue(EnumValue node) {
        return true;
    }

    public boolean visitTimeValue(TimeValue node) {
        return true;
    }

    public boolean visitDateValue(DateValue node) {
        return true;
    }

    public boolean visitLocationValue(LocationValue node) {
        return true;
    }

    public boolean visitRecurrentTimeSpecificationValue(RecurrentTimeSpecificationValue node) {
        return true;
    }

    public boolean visitArgMapValue(ArgMapValue node) {
        return true;
    }

    public boolean visitArrayValue(ArrayValue node) {
        return true;
    }

    public boolean visitObjectValue(ObjectValue node) {
        return true;
    }

    public boolean visitVarRefValue(VarRefValue node) {
        return true;
    }

    public boolean visitEventValue(EventValue node) {
        return true;
    }

    public boolean visitContextRefValue(ContextRefValue node) {
        return true;
    }

    public boolean visitUndefinedValue(UndefinedValue node) {
        return true;
    }

    public boolean visitFilterValue(FilterValue node) {
        return true;
    }

    public boolean visitArrayFieldValue(ArrayFieldValue node) {
        return true;
    }

    public boolean visitComputationValue(ComputationValue node) {
        return true;
    }

    public boolean visitNullValue(NullValue node) {
        return true;
    }

    // ==================== Invocations and program ====================

    public boolean visitInputParam(InputParam node) {
        return true;
    }

    public boolean visitDeviceSelector(DeviceSelector node) {
        return true;
    }

    public boolean visitBuiltinSelector(BuiltinSelector node) {
        return true;
    }

    public boolean visitInvocation(Invocation node) {
        return true;
    }

    public boolean visitSpecifiedPermissionFunction(SpecifiedPermissionFunction node) {
        return true;
    }

    public boolean visitBuiltinPermissionFunction(BuiltinPermissionFunction node) {
        return true;
    }

    public boolean visitClassStarPermissionFunction(ClassStarPermissionFunction node) {
        return true;
    }

    public boolean visitStarPermissionFunction(StarPermissionFunction node) {
        return true;
    }

    public boolean visitProgram(Program node) {
        return true;
    }

    public boolean visitRule(Rule node) {
        return true;
    }

    public boolean visitCommand(Command node) {
        return true;
    }

    public boolean visitAssignment(Assignment node) {
        return true;
    }

    public boolean visitDeclaration(Declaration node) {
        return true;
    }

    public boolean visitPermissionRule(PermissionRule node) {
        return true;
    }

    // ==================== Class definitions ====================

    public boolean visitArgumentDef(ArgumentDef node) {
        return true;
    }

    public boolean visitExpressionSignature(ExpressionSignature node) {
        return true;
    }

    public boolean visitFunctionDef(FunctionDef node) {
        return true;
    }

    public boolean visitClassDef(ClassDef node) {
        return true;
    }

    public boolean visitMixinImport(MixinImport node) {
        return true;
    }

    public boolean visitEntityDef(EntityDef node) {
        return true;
    }

    // ==================== Tables ====================

    public boolean visitVarRefTable(VarRefTable node) {
        return true;
    }

    public boolean visitInvocationTable(InvocationTable node) {
        return true;
    }

    public boolean visitFilteredTable(FilteredTable node) {
        return true;
    }

    public boolean visitProjectionTable(ProjectionTable node) {
        return true;
    }

    public boolean visitComputeTable(ComputeTable node) {
        return true;
    }

    public boolean visitAliasTable(AliasTable node) {
        return true;
    }

    public boolean visitAggregationTable(AggregationTable node) {
        return true;
    }

    public boolean visitSortedTable(SortedTable node) {
        return true;
    }

    public boolean visitIndexTable(IndexTable node) {
        return true;
    }

    public boolean visitSlicedTable(SlicedTable node) {
        return true;
    }

    public boolean visitJoinTable(JoinTable node) {
        return true;
    }

    public boolean visitWindowTable(WindowTable node) {
        return true;
    }

    public boolean visitTimeSeriesTable(TimeSeriesTable node) {
        return true;
    }

    public boolean visitSequenceTable(SequenceTable node) {
        return true;
    }

    public boolean visitHistoryTable(HistoryTable node) {
        return true;
    }

    // ==================== Streams ====================

    public boolean visitVarRefStream(VarRefStream node) {
        return true;
    }

    public boolean visitTimerStream(TimerStream node) {
        return true;
    }

    public boolean visitAtTimerStream(AtTimerStream node) {
        return true;
    }

    public boolean visitMonitorStream(MonitorStream node) {
        return true;
    }

    public boolean visitEdgeNewStream(EdgeNewStream node) {
        return true;
    }

    public boolean visitEdgeFilterStream(EdgeFilterStream node) {
        return true;
    }

    public boolean visitFilteredStream(FilteredStream node) {
        return true;
    }

    public boolean visitProjectionStream(ProjectionStream node) {
        return true;
    }

    public boolean visitComputeStream(ComputeStream node) {
        return true;
    }

    public boolean visitAliasStream(AliasStream node) {
        return true;
    }

    public boolean visitJoinStream(JoinStream node) {
        return true;
    }

    // ==================== Actions ====================

    public boolean visitVarRefAction(VarRefAction node) {
        return true;
    }

    public boolean visitInvocationAction(InvocationAction node) {
        return true;
    }

    // ==================== Boolean expressions ====================

    public boolean visitAndBooleanExpression(AndBooleanExpression node) {
        return true;
    }

    public boolean visitOrBooleanExpression(OrBooleanExpression node) {
        return true;
    }

    public boolean visitNotBooleanExpression(NotBooleanExpression node) {
        return true;
    }

    public boolean visitAtomBooleanExpression(AtomBooleanExpression node) {
        return true;
    }

    public boolean visitExternalBooleanExpression(ExternalBooleanExpression node) {
        return true;
    }

    public boolean visitDontCareBooleanExpression(DontCareBooleanExpression node) {
        return true;
    }

    public boolean visitComputeBooleanExpression(ComputeBooleanExpression node) {
        return true;
    }

    public boolean visitTrueBooleanExpression(TrueBooleanExpression node) {
        return true;
    }

    public boolean visitFalseBooleanExpression(FalseBooleanExpression node) {
        return true;
    }

    // ==================== Scalar expressions ====================

    public boolean visitPrimaryScalarExpression(PrimaryScalarExpression node) {
        return true;
    }

    public boolean visitDerivedScalarExpression(DerivedScalarExpression node) {
        return true;
    }

    public boolean visitAggregationScalarExpression(AggregationScalarExpression node) {
        return true;
    }

    public boolean visitVarRefScalarExpression(VarRefScalarExpression node) {
        return true;
    }
}
