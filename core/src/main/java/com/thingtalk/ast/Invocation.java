package com.thingtalk.ast;

import com.thingtalk.schema.FunctionDef;
import com.thingtalk.slots.DeviceAttributeSlot;
import com.thingtalk.slots.InvocationLike;
import com.thingtalk.slots.ScopeEntry;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.slots.Slots;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A call to a function: the selector, the function name and the bound input
 * parameters.
 *
 * <p>The schema is null until the invocation has been type-checked.
 */
public final class Invocation extends Node implements InvocationLike {

    private final Selector selector;
    private final String channel;
    private final List<InputParam> inParams;
    private FunctionDef schema;

    public Invocation(SourceRange location, Selector selector, String channel,
                      List<InputParam> inParams, FunctionDef schema) {
        super(location);
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(inParams, "inParams must not be null");
        this.inParams = new ArrayList<>(inParams);
        this.schema = schema;
    }

    public Invocation(Selector selector, String channel, List<InputParam> inParams) {
        this(null, selector, channel, inParams, null);
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
     * Adds the slots of this invocation: the device attributes, then the
     * device selector itself, then the input parameters.
     *
     * <p>Attributes come before the selector so that a consumer can fill
     * them first and use them to pick the device.
     *
     * @param scope the names available to the input parameters
     * @param into the list to append to
     * @return this invocation and its output scope
     */
    public SlotScope iterateSlots2(Map<String, ScopeEntry> scope, List<SlotItem> into) {
        if (selector instanceof DeviceSelector) {
            DeviceSelector device = (DeviceSelector) selector;
            for (InputParam attr : device.attributes()) {
                into.add(new DeviceAttributeSlot(this, attr));
            }
            into.add(device);
        }
        return Slots.iterateInputParams(this, scope, into);
    }

    @Override
    public Invocation clone() {
        List<InputParam> params = new ArrayList<>(inParams.size());
        for (InputParam param : inParams) {
            params.add(param.clone());
        }
        return new Invocation(location, selector.clone(), channel, params, schema == null ? null : schema.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitInvocation(this)) {
            selector.visit(visitor);
            for (InputParam param : inParams) {
                param.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    // required parameters that are still undefined are left out
    @Override
    public String toSource() {
        List<InputParam> printed = new ArrayList<>();
        for (InputParam param : inParams) {
            if (schema != null && param.value().isUndefined() && Boolean.TRUE.equals(schema.isArgRequired(param.name()))) {
                continue;
            }
            printed.add(param);
        }
        String prefix = selector.isBuiltin() ? "" : selector.toSource() + ".";
        return prefix + channel + "(" + SourceFormat.join(printed, InputParam::toSource, ", ") + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Invocation)) return false;
        Invocation that = (Invocation) obj;
        return selector.equals(that.selector)
            && channel.equals(that.channel)
            && inParams.equals(that.inParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, channel, inParams);
    }

    @Override
    public String toString() {
        return "Invocation(" + selector + ", " + channel + ", " + inParams + ")";
    }
}
