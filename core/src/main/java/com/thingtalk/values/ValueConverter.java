package com.thingtalk.values;

import com.thingtalk.types.ArrayType;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.EnumType;
import com.thingtalk.types.MeasureType;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.types.TypeParser;

import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts plain Java objects to {@link Value}s.
 *
 * <p>This is the inverse of {@link Value#toJS()}: booleans, strings, numbers,
 * lists and maps are turned into the value variant the expected type calls
 * for. When the expected type is Any, the variant is inferred from the Java
 * class of the object.
 */
final class ValueConverter {

    private ValueConverter() {} // Utility class

    static Value fromJS(Type type, Object v) {
        Objects.requireNonNull(type, "type must not be null");
        if (v == null) {
            return new NullValue();
        }

        if (type instanceof EntityType) {
            String entityType = ((EntityType) type).entityName();
            if (v instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) v;
                return new EntityValue(asString(map.get("value")), entityType, asString(map.get("display")));
            }
            return new EntityValue(v.toString(), entityType, null);
        }
        if (type instanceof MeasureType) {
            return new MeasureValue(asNumber(v), ((MeasureType) type).unit());
        }
        if (type instanceof EnumType) {
            return new EnumValue(v.toString());
        }
        if (type instanceof ArrayType) {
            Type elem = ((ArrayType) type).elementType();
            List<Value> values = new ArrayList<>();
            for (Object item : asList(v)) {
                values.add(fromJS(elem, item));
            }
            return new ArrayValue(null, values, elem);
        }
        if (!(type instanceof PrimitiveType)) {
            return inferValue(v);
        }

        PrimitiveType primitive = (PrimitiveType) type;
        if (primitive == PrimitiveType.BOOLEAN) {
            return new BooleanValue((Boolean) v);
        }
        if (primitive == PrimitiveType.STRING) {
            return new StringValue(v.toString());
        }
        if (primitive == PrimitiveType.NUMBER) {
            return new NumberValue(asNumber(v));
        }
        if (primitive == PrimitiveType.CURRENCY) {
            if (v instanceof Map) {
                Map<?, ?> map = (Map<?, ?>) v;
                return new CurrencyValue(asNumber(map.get("value")), String.valueOf(map.get("code")));
            }
            return new CurrencyValue(asNumber(v), "usd");
        }
        if (primitive == PrimitiveType.TIME) {
            return new TimeValue(toTime(v));
        }
        if (primitive == PrimitiveType.DATE) {
            if (v instanceof Instant) {
                return new DateValue(new DateValue.Absolute((Instant) v));
            }
            return new DateValue(new DateValue.Absolute(Instant.parse(v.toString())));
        }
        if (primitive == PrimitiveType.LOCATION) {
            Map<?, ?> map = asMap(v);
            Object lat = map.containsKey("y") ? map.get("y") : map.get("lat");
            Object lon = map.containsKey("x") ? map.get("x") : map.get("lon");
            return new LocationValue(new LocationValue.Absolute(asNumber(lat), asNumber(lon), asString(map.get("display"))));
        }
        if (primitive == PrimitiveType.ARG_MAP) {
            Map<String, Type> args = new LinkedHashMap<>();
            asMap(v).forEach((name, t) -> args.put(name.toString(), TypeParser.parse(t.toString())));
            return new ArgMapValue(args);
        }
        if (primitive == PrimitiveType.OBJECT) {
            Map<String, Value> fields = new LinkedHashMap<>();
            asMap(v).forEach((name, field) -> fields.put(name.toString(), inferValue(field)));
            return new ObjectValue(fields);
        }
        if (primitive == PrimitiveType.RECURRENT_TIME_SPECIFICATION) {
            List<RecurrentTimeSpecificationValue.Rule> rules = new ArrayList<>();
            for (Object item : asList(v)) {
                rules.add(toRule(asMap(item)));
            }
            return new RecurrentTimeSpecificationValue(rules);
        }
        return inferValue(v);
    }

    private static Value inferValue(Object v) {
        if (v == null) {
            return new NullValue();
        }
        if (v instanceof Boolean) {
            return new BooleanValue((Boolean) v);
        }
        if (v instanceof Number) {
            return new NumberValue(((Number) v).doubleValue());
        }
        if (v instanceof String) {
            return new StringValue((String) v);
        }
        if (v instanceof Instant) {
            return new DateValue(new DateValue.Absolute((Instant) v));
        }
        if (v instanceof LocalTime) {
            return fromJS(PrimitiveType.TIME, v);
        }
        if (v instanceof List) {
            List<Value> values = new ArrayList<>();
            for (Object item : (List<?>) v) {
                values.add(inferValue(item));
            }
            return new ArrayValue(values);
        }
        if (v instanceof Map) {
            return fromJS(PrimitiveType.OBJECT, v);
        }
        throw new IllegalArgumentException("Cannot convert " + v.getClass().getSimpleName() + " to a value");
    }

    private static TimeValue.Absolute toTime(Object v) {
        if (v instanceof LocalTime) {
            LocalTime time = (LocalTime) v;
            return new TimeValue.Absolute(time.getHour(), time.getMinute(), time.getSecond());
        }
        if (v instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) v;
            Object second = map.get("second");
            return new TimeValue.Absolute(
                (int) asNumber(map.get("hour")),
                (int) asNumber(map.get("minute")),
                second == null ? 0 : (int) asNumber(second));
        }
        String[] parts = v.toString().split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Invalid time '" + v + "'");
        }
        return new TimeValue.Absolute(
            Integer.parseInt(parts[0]),
            Integer.parseInt(parts[1]),
            parts.length == 3 ? Integer.parseInt(parts[2]) : 0);
    }

    private static RecurrentTimeSpecificationValue.Rule toRule(Map<?, ?> map) {
        Object interval = map.get("interval");
        Object frequency = map.get("frequency");
        Object subtract = map.get("subtract");
        return new RecurrentTimeSpecificationValue.Rule(
            toTime(map.get("beginTime")),
            toTime(map.get("endTime")),
            new MeasureValue(interval == null ? 86_400_000 : asNumber(interval), "ms"),
            frequency == null ? 1 : (int) asNumber(frequency),
            asString(map.get("dayOfWeek")),
            toInstant(map.get("beginDate")),
            toInstant(map.get("endDate")),
            subtract != null && (Boolean) subtract);
    }

    private static Instant toInstant(Object v) {
        if (v == null) {
            return null;
        }
        return v instanceof Instant ? (Instant) v : Instant.parse(v.toString());
    }

    private static double asNumber(Object v) {
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        if (v == null) {
            throw new IllegalArgumentException("Expected a number, got null");
        }
        return Double.parseDouble(v.toString());
    }

    private static String asString(Object v) {
        return v == null ? null : v.toString();
    }

    private static List<?> asList(Object v) {
        if (!(v instanceof List)) {
            throw new IllegalArgumentException("Expected a list, got " + v.getClass().getSimpleName());
        }
        return (List<?>) v;
    }

    private static Map<?, ?> asMap(Object v) {
        if (!(v instanceof Map)) {
            throw new IllegalArgumentException("Expected a map, got " + v.getClass().getSimpleName());
        }
        return (Map<?, ?>) v;
    }
}
