package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Time of day: either an absolute clock time or a relative tag
 * ({@code $time.morning}) resolved against user preferences.
 */
public final class TimeValue extends Value {

    /** Time specification. */
    public sealed interface Spec permits Absolute, Relative {}

    /**
     * Absolute clock time.
     *
     * @param hour hour of day, 0-23
     * @param minute minute, 0-59
     * @param second second, 0-59
     */
    public record Absolute(int hour, int minute, int second) implements Spec {
        public Absolute {
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || second < 0 || second > 59) {
                throw new IllegalArgumentException(
                    String.format("Invalid time %d:%02d:%02d", hour, minute, second));
            }
        }

        @Override
        public String toString() {
            return second == 0
                ? String.format("%d:%02d", hour, minute)
                : String.format("%d:%02d:%02d", hour, minute, second);
        }
    }

    /**
     * Time relative to the user's context, e.g. "morning" or "evening".
     *
     * @param tag the context tag
     */
    public record Relative(String tag) implements Spec {
        public Relative {
            Objects.requireNonNull(tag, "tag must not be null");
        }
    }

    private final Spec value;

    public TimeValue(SourceRange location, Spec value) {
        super(location);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public TimeValue(Spec value) {
        this(null, value);
    }

    public Spec value() {
        return value;
    }

    @Override
    public Type getType() {
        return PrimitiveType.TIME;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public boolean isConcrete() {
        return value instanceof Absolute;
    }

    @Override
    public Object toJS() {
        if (value instanceof Absolute) {
            Absolute abs = (Absolute) value;
            return LocalTime.of(abs.hour(), abs.minute(), abs.second());
        }
        throw new IllegalStateException("Unresolved relative time " + toSource());
    }

    @Override
    public TimeValue clone() {
        return new TimeValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitTimeValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        if (value instanceof Absolute) {
            Absolute abs = (Absolute) value;
            if (abs.second() == 0) {
                return "new Time(" + abs.hour() + ", " + abs.minute() + ")";
            }
            return "new Time(" + abs.hour() + ", " + abs.minute() + ", " + abs.second() + ")";
        }
        return "$time." + ((Relative) value).tag();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TimeValue)) return false;
        return value.equals(((TimeValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Time(" + value + ")";
    }
}
