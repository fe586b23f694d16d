package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Set of recurring time intervals, such as "weekdays from 9am to 5pm".
 *
 * <p>Each rule adds (or, when {@code subtract} is set, removes) the time
 * between {@code beginTime} and {@code endTime}, repeated every
 * {@code interval}, optionally restricted to a week day and a date range.
 */
public final class RecurrentTimeSpecificationValue extends Value {

    /**
     * One recurrence rule.
     *
     * @param beginTime start of the interval each day
     * @param endTime end of the interval each day
     * @param interval repetition period (a time measure)
     * @param frequency how many times the interval repeats per period
     * @param dayOfWeek restricts the rule to a week day, or null
     * @param beginDate first date the rule applies, or null
     * @param endDate last date the rule applies, or null
     * @param subtract whether the rule removes time instead of adding it
     */
    public record Rule(TimeValue.Absolute beginTime,
                       TimeValue.Absolute endTime,
                       MeasureValue interval,
                       int frequency,
                       String dayOfWeek,
                       Instant beginDate,
                       Instant endDate,
                       boolean subtract) {

        public Rule {
            Objects.requireNonNull(beginTime, "beginTime must not be null");
            Objects.requireNonNull(endTime, "endTime must not be null");
            Objects.requireNonNull(interval, "interval must not be null");
            if (frequency < 1) {
                throw new IllegalArgumentException("frequency must be positive, got " + frequency);
            }
        }

        Map<String, Object> toJS() {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("beginTime", beginTime.toString());
            result.put("endTime", endTime.toString());
            result.put("interval", interval.toJS());
            result.put("frequency", frequency);
            result.put("dayOfWeek", dayOfWeek);
            result.put("beginDate", beginDate);
            result.put("endDate", endDate);
            result.put("subtract", subtract);
            return result;
        }

        String toSource() {
            StringBuilder sb = new StringBuilder("{ beginTime=");
            sb.append(new TimeValue(beginTime).toSource());
            sb.append(", endTime=").append(new TimeValue(endTime).toSource());
            if (interval.value() != 1 || !interval.unit().equals("day")) {
                sb.append(", interval=").append(interval.toSource());
            }
            if (frequency != 1) {
                sb.append(", frequency=").append(frequency);
            }
            if (dayOfWeek != null) {
                sb.append(", dayOfWeek=enum ").append(dayOfWeek);
            }
            if (beginDate != null) {
                sb.append(", beginDate=").append(new DateValue(new DateValue.Absolute(beginDate)).toSource());
            }
            if (endDate != null) {
                sb.append(", endDate=").append(new DateValue(new DateValue.Absolute(endDate)).toSource());
            }
            if (subtract) {
                sb.append(", subtract=true");
            }
            return sb.append(" }").toString();
        }
    }

    private final List<Rule> rules;

    public RecurrentTimeSpecificationValue(SourceRange location, List<Rule> rules) {
        super(location);
        Objects.requireNonNull(rules, "rules must not be null");
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public RecurrentTimeSpecificationValue(List<Rule> rules) {
        this(null, rules);
    }

    public List<Rule> rules() {
        return rules;
    }

    @Override
    public Type getType() {
        return PrimitiveType.RECURRENT_TIME_SPECIFICATION;
    }

    @Override
    public Object toJS() {
        List<Object> result = new ArrayList<>();
        for (Rule rule : rules) {
            result.add(rule.toJS());
        }
        return result;
    }

    @Override
    public RecurrentTimeSpecificationValue clone() {
        return new RecurrentTimeSpecificationValue(location, rules);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitRecurrentTimeSpecificationValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        List<String> parts = new ArrayList<>();
        for (Rule rule : rules) {
            parts.add(rule.toSource());
        }
        return "new RecurrentTimeSpecification(" + String.join(", ", parts) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RecurrentTimeSpecificationValue)) return false;
        return rules.equals(((RecurrentTimeSpecificationValue) obj).rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "RecurrentTimeSpecification(" + rules + ")";
    }
}
