package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Calendar date and time.
 *
 * <p>A null specification means "now". Other forms are an absolute instant,
 * the start or end of the current unit ({@code $start_of(week)}), a partial
 * date whose missing fields default to today, and the next occurrence of a
 * week day.
 */
public final class DateValue extends Value {

    /** Time units accepted by edge dates, from finest to coarsest. */
    public static final List<String> EDGE_UNITS = List.of("ms", "s", "min", "h", "day", "week", "mon", "year");

    /** Date specification. */
    public sealed interface Spec permits Absolute, Edge, Piece, WeekDay {}

    /**
     * A fixed instant.
     *
     * @param instant the instant
     */
    public record Absolute(Instant instant) implements Spec {
        public Absolute {
            Objects.requireNonNull(instant, "instant must not be null");
        }
    }

    /**
     * Start or end of the current time unit.
     *
     * @param edge "start_of" or "end_of"
     * @param unit one of {@link #EDGE_UNITS}
     */
    public record Edge(String edge, String unit) implements Spec {
        public Edge {
            if (!"start_of".equals(edge) && !"end_of".equals(edge)) {
                throw new IllegalArgumentException("Invalid date edge " + edge);
            }
            if (!EDGE_UNITS.contains(unit)) {
                throw new IllegalArgumentException("Invalid date edge unit " + unit);
            }
        }
    }

    /**
     * Partial date; null fields default to the current year, month or day.
     *
     * @param year the year, or null
     * @param month the month 1-12, or null
     * @param day the day of month, or null
     * @param time the time of day, or null for midnight
     */
    public record Piece(Integer year, Integer month, Integer day, TimeValue.Absolute time) implements Spec {}

    /**
     * Next occurrence of a week day, today included.
     *
     * @param weekday the day name, e.g. "monday"
     * @param time the time of day, or null for midnight
     */
    public record WeekDay(String weekday, TimeValue.Absolute time) implements Spec {
        public WeekDay {
            Objects.requireNonNull(weekday, "weekday must not be null");
            DayOfWeek.valueOf(weekday.toUpperCase(Locale.ROOT));
        }
    }

    private final Spec value;

    /**
     * Creates a date value.
     *
     * @param location the source location, or null
     * @param value the date specification, or null for "now"
     */
    public DateValue(SourceRange location, Spec value) {
        super(location);
        this.value = value;
    }

    public DateValue(Spec value) {
        this(null, value);
    }

    /**
     * Creates a date value denoting the current instant.
     *
     * @return the date value
     */
    public static DateValue now() {
        return new DateValue(null, null);
    }

    /**
     * Returns the specification of this date.
     *
     * @return the specification, or null for "now"
     */
    public Spec value() {
        return value;
    }

    @Override
    public Type getType() {
        return PrimitiveType.DATE;
    }

    @Override
    public Object toJS() {
        return resolve(ZonedDateTime.now());
    }

    /**
     * Computes the instant this date denotes relative to the given time.
     *
     * @param now the reference time, carrying the time zone to compute in
     * @return the instant
     */
    public Instant resolve(ZonedDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        if (value == null) {
            return now.toInstant();
        }
        if (value instanceof Absolute) {
            return ((Absolute) value).instant();
        }
        if (value instanceof Edge) {
            Edge edge = (Edge) value;
            ZonedDateTime start = startOf(now, edge.unit());
            return edge.edge().equals("end_of") ? addOne(start, edge.unit()).toInstant() : start.toInstant();
        }
        if (value instanceof Piece) {
            Piece piece = (Piece) value;
            ZonedDateTime date = now.truncatedTo(ChronoUnit.DAYS)
                .withYear(piece.year() != null ? piece.year() : now.getYear())
                .withMonth(piece.month() != null ? piece.month() : now.getMonthValue())
                .withDayOfMonth(piece.day() != null ? piece.day() : now.getDayOfMonth());
            return atTime(date, piece.time()).toInstant();
        }
        WeekDay weekDay = (WeekDay) value;
        DayOfWeek dow = DayOfWeek.valueOf(weekDay.weekday().toUpperCase(Locale.ROOT));
        ZonedDateTime date = now.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.nextOrSame(dow));
        return atTime(date, weekDay.time()).toInstant();
    }

    private static ZonedDateTime atTime(ZonedDateTime date, TimeValue.Absolute time) {
        if (time == null) {
            return date;
        }
        return date.withHour(time.hour()).withMinute(time.minute()).withSecond(time.second());
    }

    private static ZonedDateTime startOf(ZonedDateTime now, String unit) {
        switch (unit) {
            case "ms":
                return now;
            case "s":
                return now.truncatedTo(ChronoUnit.SECONDS);
            case "min":
                return now.truncatedTo(ChronoUnit.MINUTES);
            case "h":
                return now.truncatedTo(ChronoUnit.HOURS);
            case "day":
                return now.truncatedTo(ChronoUnit.DAYS);
            case "week":
                // weeks start on Sunday
                return now.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
            case "mon":
                return now.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            case "year":
                return now.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
            default:
                throw new IllegalArgumentException("Invalid date edge unit " + unit);
        }
    }

    private static ZonedDateTime addOne(ZonedDateTime date, String unit) {
        switch (unit) {
            case "ms":
                return date.plus(1, ChronoUnit.MILLIS);
            case "s":
                return date.plusSeconds(1);
            case "min":
                return date.plusMinutes(1);
            case "h":
                return date.plusHours(1);
            case "day":
                return date.plusDays(1);
            case "week":
                return date.plusWeeks(1);
            case "mon":
                return date.plusMonths(1);
            case "year":
                return date.plusYears(1);
            default:
                throw new IllegalArgumentException("Invalid date edge unit " + unit);
        }
    }

    @Override
    public DateValue clone() {
        return new DateValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitDateValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        if (value == null) {
            return "$now";
        }
        if (value instanceof Absolute) {
            return "new Date(" + SourceFormat.quote(((Absolute) value).instant().toString()) + ")";
        }
        if (value instanceof Edge) {
            Edge edge = (Edge) value;
            return "$" + edge.edge() + "(" + edge.unit() + ")";
        }
        if (value instanceof Piece) {
            Piece piece = (Piece) value;
            StringBuilder sb = new StringBuilder("new Date(");
            sb.append(piece.year() != null ? piece.year().toString() : "").append(", ");
            sb.append(piece.month() != null ? piece.month().toString() : "").append(", ");
            sb.append(piece.day() != null ? piece.day().toString() : "");
            if (piece.time() != null) {
                sb.append(", ").append(new TimeValue(piece.time()).toSource());
            }
            return sb.append(')').toString();
        }
        WeekDay weekDay = (WeekDay) value;
        if (weekDay.time() != null) {
            return "new Date(" + weekDay.weekday() + ", " + new TimeValue(weekDay.time()).toSource() + ")";
        }
        return "new Date(" + weekDay.weekday() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DateValue)) return false;
        return Objects.equals(value, ((DateValue) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Date", value);
    }

    @Override
    public String toString() {
        return "Date(" + (value == null ? "now" : value) + ")";
    }
}
