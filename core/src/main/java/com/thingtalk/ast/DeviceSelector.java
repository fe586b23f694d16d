package com.thingtalk.ast;

import com.thingtalk.slots.SlotItem;
import com.thingtalk.util.SourceFormat;
import com.thingtalk.values.EntityValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Selects one or more devices of a class.
 *
 * <p>With an id, exactly that device. Without an id and without attributes,
 * any device of the kind, chosen by the user. Without an id but with
 * attributes, the devices matching the attributes; with {@code all} set,
 * every matching device rather than asking the user to pick one.
 *
 * <p>The id is set once a device has been chosen, so it is mutable.
 */
public final class DeviceSelector extends Selector implements SlotItem {

    private final String kind;
    private String id;
    private final List<InputParam> attributes;
    private final boolean all;

    public DeviceSelector(SourceRange location, String kind, String id, List<InputParam> attributes, boolean all) {
        super(location);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.id = id;
        this.attributes = attributes == null ? new ArrayList<>() : new ArrayList<>(attributes);
        this.all = all;
    }

    public DeviceSelector(String kind, String id) {
        this(null, kind, id, new ArrayList<>(), false);
    }

    public String kind() {
        return kind;
    }

    /**
     * Returns the id of the selected device.
     *
     * @return the id, or null if no device has been chosen
     */
    public String id() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    /**
     * Returns the live list of attributes.
     *
     * @return the attributes
     */
    public List<InputParam> attributes() {
        return attributes;
    }

    public boolean all() {
        return all;
    }

    public InputParam getAttribute(String name) {
        for (InputParam attr : attributes) {
            if (attr.name().equals(name)) {
                return attr;
            }
        }
        return null;
    }

    @Override
    public DeviceSelector clone() {
        List<InputParam> copy = new ArrayList<>(attributes.size());
        for (InputParam attr : attributes) {
            copy.add(attr.clone());
        }
        return new DeviceSelector(location, kind, id, copy, all);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitDeviceSelector(this)) {
            for (InputParam attr : attributes) {
                attr.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    // the id is omitted when it equals the kind: there is only one such device
    @Override
    public String toSource() {
        List<String> parts = new ArrayList<>();
        if (all) {
            parts.add("all=true");
        } else if (id != null && !id.equals(kind)) {
            InputParam name = getAttribute("name");
            String display = name == null ? null : String.valueOf(name.value().toJS());
            parts.add("id=" + new EntityValue(id, "tt:device_id", display).toSource());
        }
        List<InputParam> sorted = new ArrayList<>(attributes);
        sorted.sort(Comparator.comparing(InputParam::name));
        for (InputParam attr : sorted) {
            if (attr.value().isUndefined() || ("name".equals(attr.name()) && id != null)) {
                continue;
            }
            parts.add(attr.toSource());
        }
        if (parts.isEmpty()) {
            return "@" + kind;
        }
        return "@" + kind + "(" + SourceFormat.join(parts, part -> part, ", ") + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DeviceSelector)) return false;
        DeviceSelector that = (DeviceSelector) obj;
        return kind.equals(that.kind)
            && Objects.equals(id, that.id)
            && attributes.equals(that.attributes)
            && all == that.all;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, all);
    }

    @Override
    public String toString() {
        return "Device(" + kind + ", " + (id == null ? "" : id) + ")";
    }
}
