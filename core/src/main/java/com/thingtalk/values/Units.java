package com.thingtalk.values;

import java.util.HashMap;
import java.util.Map;

/**
 * Conversion of measurement units to the base unit of their dimension.
 *
 * <p>Base units: {@code ms} (time), {@code m} (length), {@code C}
 * (temperature), {@code byte} (data), {@code kg} (mass), {@code mps}
 * (speed), {@code m2} (area), {@code m3} (volume), {@code kcal} (energy),
 * {@code W} (power). Units the table does not know, including placeholder
 * units such as {@code defaultTemperature}, are their own base unit.
 */
public final class Units {

    private Units() {} // Utility class

    private record Unit(String base, double scale) {}

    private static final Map<String, Unit> UNITS = new HashMap<>();

    static {
        time("ms", 1);
        time("s", 1000);
        time("min", 60_000);
        time("h", 3_600_000);
        time("day", 86_400_000);
        time("week", 604_800_000);
        time("mon", 2_592_000_000.0);
        time("year", 31_536_000_000.0);

        define("m", "m", 1);
        define("km", "m", 1000);
        define("mm", "m", 0.001);
        define("cm", "m", 0.01);
        define("mi", "m", 1609.344);
        define("in", "m", 0.0254);
        define("ft", "m", 0.3048);

        define("byte", "byte", 1);
        define("KB", "byte", 1000);
        define("KiB", "byte", 1024);
        define("MB", "byte", 1e6);
        define("MiB", "byte", 1_048_576);
        define("GB", "byte", 1e9);
        define("GiB", "byte", 1_073_741_824);
        define("TB", "byte", 1e12);

        define("kg", "kg", 1);
        define("g", "kg", 0.001);
        define("lb", "kg", 0.45359237);
        define("oz", "kg", 0.028349523125);

        define("mps", "mps", 1);
        define("kmph", "mps", 1 / 3.6);
        define("mph", "mps", 0.44704);

        define("m2", "m2", 1);
        define("km2", "m2", 1e6);
        define("ft2", "m2", 0.09290304);

        define("m3", "m3", 1);
        define("l", "m3", 0.001);
        define("gal", "m3", 0.00378541);

        define("kcal", "kcal", 1);
        define("kJ", "kcal", 0.239006);

        define("W", "W", 1);
        define("kW", "W", 1000);

        define("C", "C", 1);
        define("F", "C", 1);
        define("K", "C", 1);
    }

    private static void time(String unit, double scale) {
        define(unit, "ms", scale);
    }

    private static void define(String unit, String base, double scale) {
        UNITS.put(unit, new Unit(base, scale));
    }

    /**
     * Returns the base unit of the dimension of the given unit.
     *
     * @param unit the unit, e.g. "min"
     * @return the base unit, e.g. "ms"
     */
    public static String normalizeUnit(String unit) {
        Unit known = UNITS.get(unit);
        return known == null ? unit : known.base();
    }

    /**
     * Converts a quantity to the base unit of its dimension.
     *
     * @param value the quantity
     * @param unit the unit the quantity is expressed in
     * @return the quantity in the base unit
     */
    public static double transformToBaseUnit(double value, String unit) {
        switch (unit) {
            case "F":
                return (value - 32) * 5 / 9;
            case "K":
                return value - 273.15;
            default:
                Unit known = UNITS.get(unit);
                return known == null ? value : value * known.scale();
        }
    }
}
