package com.thingtalk.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives human-readable labels from identifiers.
 */
public final class Names {

    private static final Pattern HUNGARIAN_PREFIX = Pattern.compile("^[vwgp]_");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([^A-Z ])([A-Z])");

    private static final String[] KIND_PREFIXES = {
        "org.thingpedia.builtin.thingengine.",
        "org.thingpedia.builtin.",
        "org.thingpedia.",
        "io.home-assistant.",
        "com.",
        "gov.",
        "org.",
        "uk.co.",
    };

    private Names() {} // Utility class

    /**
     * Turns an argument or function name into a lower-case label.
     *
     * <p>Examples: {@code v_title} becomes "title", {@code file_name} becomes
     * "file name", {@code inReplyTo} becomes "in reply to".
     *
     * @param name the identifier
     * @return the label
     */
    public static String clean(String name) {
        String stripped = HUNGARIAN_PREFIX.matcher(name).find() ? name.substring(2) : name;
        String spaced = stripped.replace('_', ' ');
        return CAMEL_BOUNDARY.matcher(spaced).replaceAll("$1 $2").toLowerCase(Locale.ROOT);
    }

    /**
     * Turns a class kind into a label, dropping well-known namespace prefixes.
     *
     * <p>Examples: {@code org.thingpedia.weather} becomes "weather",
     * {@code com.xkcd} becomes "xkcd".
     *
     * @param kind the class kind
     * @return the label
     */
    public static String cleanKind(String kind) {
        String result = kind;
        for (String prefix : KIND_PREFIXES) {
            if (result.startsWith(prefix)) {
                result = result.substring(prefix.length());
            }
        }
        return clean(result.replaceAll("[.-]", " "));
    }
}
