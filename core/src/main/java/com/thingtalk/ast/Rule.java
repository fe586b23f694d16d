package com.thingtalk.ast;

import com.thingtalk.logical.Action;
import com.thingtalk.logical.Stream;
import com.thingtalk.slots.SlotItem;
import com.thingtalk.slots.SlotScope;
import com.thingtalk.util.SourceFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code stream => action;}: runs the actions on every event of the stream.
 */
public final class Rule extends Statement {

    private final Stream stream;
    private final List<Action> actions;

    public Rule(SourceRange location, Stream stream, List<Action> actions) {
        super(location);
        this.stream = Objects.requireNonNull(stream, "stream must not be null");
        Objects.requireNonNull(actions, "actions must not be null");
        requireActions(actions);
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    }

    public Rule(Stream stream, List<Action> actions) {
        this(null, stream, actions);
    }

    public Stream stream() {
        return stream;
    }

    public List<Action> actions() {
        return actions;
    }

    // the actions see the outputs of each event
    @Override
    public void iterateSlots2(List<SlotItem> into) {
        SlotScope scope = stream.iterateSlots2(Collections.emptyMap(), into);
        for (Action action : actions) {
            action.iterateSlots2(scope.scope(), into);
        }
    }

    @Override
    public Rule clone() {
        List<Action> copy = new ArrayList<>(actions.size());
        for (Action action : actions) {
            copy.add(action.clone());
        }
        return new Rule(location, stream.clone(), copy);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitRule(this)) {
            stream.visit(visitor);
            for (Action action : actions) {
                action.visit(visitor);
            }
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return stream.toSource() + " => " + SourceFormat.join(actions, Action::toSource, ", ") + ";";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rule)) return false;
        Rule that = (Rule) obj;
        return stream.equals(that.stream) && actions.equals(that.actions);
    }

    @Override
    public int hashCode() {
        return Objects.hash("rule", stream, actions);
    }

    @Override
    public String toString() {
        return "Rule(" + stream + ", " + actions + ")";
    }
}
