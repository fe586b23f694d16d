package com.thingtalk.util;

import com.thingtalk.ast.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Helpers for printing surface syntax.
 */
public final class SourceFormat {

    private SourceFormat() {} // Utility class

    /**
     * Quotes a string literal, escaping quotes, backslashes and control characters.
     *
     * @param value the raw string
     * @return the quoted literal
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Formats a number without a trailing ".0" when it is integral.
     *
     * @param value the number
     * @return the formatted number
     */
    public static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * Joins the source form of each element with the separator.
     *
     * @param items the elements
     * @param printer prints one element
     * @param separator the separator
     * @param <T> the element type
     * @return the joined text
     */
    public static <T> String join(List<T> items, Function<T, String> printer, String separator) {
        return items.stream().map(printer).collect(Collectors.joining(separator));
    }

    /**
     * Prints a natural-language annotation value: a string, a number, a
     * boolean, a list or a map of those.
     *
     * @param value the annotation value
     * @return the literal
     */
    public static String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return quote((String) value);
        }
        if (value instanceof Number) {
            return number(((Number) value).doubleValue());
        }
        if (value instanceof List) {
            return "[" + join(new ArrayList<Object>((List<?>) value), SourceFormat::literal, ", ") + "]";
        }
        if (value instanceof Map) {
            List<String> parts = new ArrayList<>();
            ((Map<?, ?>) value).forEach((k, v) -> parts.add(k + "=" + literal(v)));
            return "{ " + String.join(", ", parts) + " }";
        }
        return value.toString();
    }

    /**
     * Prints natural-language annotations ({@code #_[key=...]}) followed by
     * implementation annotations ({@code #[key=...]}), each preceded by a space.
     *
     * @param nl the natural-language annotations
     * @param impl the implementation annotations
     * @return the annotation text, empty if there are none
     */
    public static String annotations(Map<String, ?> nl, Map<String, ? extends Node> impl) {
        StringBuilder sb = new StringBuilder();
        nl.forEach((key, value) -> sb.append(" #_[").append(key).append('=').append(literal(value)).append(']'));
        impl.forEach((key, value) -> sb.append(" #[").append(key).append('=').append(value.toSource()).append(']'));
        return sb.toString();
    }
}
