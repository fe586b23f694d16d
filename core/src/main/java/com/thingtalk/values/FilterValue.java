package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.exception.NotConstantException;
import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.types.Type;

import java.util.Objects;

/**
 * The elements of an array-valued expression that satisfy a predicate,
 * e.g. {@code attendees filter { name =~ "bob" }}.
 */
public final class FilterValue extends Value {

    private final Value value;
    private final BooleanExpression filter;

    public FilterValue(SourceRange location, Value value, BooleanExpression filter) {
        super(location);
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
    }

    public FilterValue(Value value, BooleanExpression filter) {
        this(null, value, filter);
    }

    public Value value() {
        return value;
    }

    public BooleanExpression filter() {
        return filter;
    }

    @Override
    public Type getType() {
        return value.getType();
    }

    @Override
    public boolean isConstant() {
        return false;
    }

    @Override
    public Object toJS() {
        throw new NotConstantException(toSource());
    }

    @Override
    public FilterValue clone() {
        return new FilterValue(location, value.clone(), filter.clone());
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        if (visitor.visitFilterValue(this)) {
            value.visit(visitor);
            filter.visit(visitor);
        }
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return value.toSource() + " filter { " + filter.toSource() + " }";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FilterValue)) return false;
        FilterValue that = (FilterValue) obj;
        return value.equals(that.value) && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, filter);
    }

    @Override
    public String toString() {
        return "Filter(" + value + ", " + filter + ")";
    }
}
