package com.thingtalk.expression;

import com.thingtalk.ast.DeviceSelector;
import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.Selector;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.schema.ExpressionSignature;
import com.thingtalk.schema.FunctionDef;
import com.thingtalk.slots.DeviceAttributeSlot;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.Slots;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Existential subquery: true if the invoked query returns at least one
 * result satisfying the inner filter, e.g.
 * {@code any(@org.weather.current(location=$here) filter temperature >= 20C)}.
 *
 * <p>The inner filter refers to the outputs of the subquery, not of the
 * enclosing expression.
 */
public final class ExternalBooleanExpression extends BooleanExpression implements InvocationLike {

    private final Selector selector;
    private final String channel;
    private final List<InputParam> inParams;
    private final BooleanExpression filter;
    private FunctionDef schema;

    public ExternalBooleanExpression(SourceRange location, Selector selector, String channel,
                                     List<InputParam> inParams, BooleanExpression filter, FunctionDef schema) {
        super(location);
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        this.inParams = new ArrayList<>(inParams);
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        this.schema = schema;
    }

    public ExternalBooleanExpression(Selector selector, String channel, List<InputParam> inParams,
                                     BooleanExpression filter) {
        this(null, selector, channel, inParams, filter, null);
    }

    public Selector selector() {
        return selector;
    }

    public String channel() {
        return channel;
    }

    @Override
    public List<InputParam> inParams() {
        return inParams;
    }

    public BooleanExpression filter() {
        return filter;
    }

    @Override
    public FunctionDef schema() {
        return schema;
    }

    public void setSchema(FunctionDef schema) {
        this.schema = schema;
    }

    @Override
    public String selectorKind() {
        return selector instanceof DeviceSelector ? ((DeviceSelector) selector).kind() : null;
    }

    /**
     * Adds the device attributes and the device selector of the subquery,
     * then its input parameter slots, then the slots of the inner filter,
     * resolved against the subquery's own outputs.
     */
    @Override
    public void iterateSlots2(ExpressionSignature outerSchema, InvocationLike primitive,
                              Map<String, ScopeEntry> scope, List<SlotItem> into) {
        if (selector instanceof DeviceSelector) {
            DeviceSelector device = (DeviceSelector) selector;
            for (InputParam attr : device.attributes()) {
                into.add(new DeviceAttributeSlot(this, attr));
            }
            into.add(device);
        }
        Slots.iterateInputParams(this, scope, into);
        filter.iterateSlots2(schema, this, Slots.makeScope(this), into);
    }

    @Override
    public ExternalBooleanExpression clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new ExternalBooleanExpression(location, selector.clone(), channel, params, filter.clone(),
            schema == null ? null : schema.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitExternalBooleanExpression(this)) {
            selector.visit(visitor);
            for (InputParam param : inParams) {
                param.visit(visitor);
            }
            filter.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        String prefix = selector.isBuiltin() ? "" : selector.toSource() + ".";
        return "any(" + prefix + channel + "(" + SourceFormat.join(inParams, InputParam::toSource, ", ")
            + ") filter " + filter.toSource() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ExternalBooleanExpression)) return false;
        ExternalBooleanExpression that = (ExternalBooleanExpression) obj;
        return selector.equals(that.selector)
            && channel.equals(that.channel)
            && inParams.equals(that.inParams)
            && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, channel, inParams, filter);
    }

    @Override
    public String toString() {
        return "External(" + selector + ", " + channel + ", " + inParams + ", " + filter + ")";
    }
}
