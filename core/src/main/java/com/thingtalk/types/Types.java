package com.thingtalk.types;

import java.util.Objects;

/**
 * Assignability rules between types.
 *
 * <p>Assignability is directional: {@code isAssignable(from, to)} answers
 * whether a value of type {@code from} may be used where {@code to} is
 * expected.
 *
 * <p>Rules:
 * <ul>
 *   <li>Equal types are assignable</li>
 *   <li>Unknown types are never assignable to a different type</li>
 *   <li>Any is assignable to and from everything</li>
 *   <li>Date is assignable to Time, Number to Currency</li>
 *   <li>Measure(u) is assignable to Measure(u) and to the unit-less Measure()</li>
 *   <li>Arrays are assignable element-wise</li>
 *   <li>Enums are assignable to an enum that accepts all their entries</li>
 * </ul>
 */
public final class Types {

    private Types() {} // Utility class

    /**
     * Returns whether a value of type {@code from} can be used where
     * {@code to} is expected.
     *
     * @param from the source type
     * @param to the target type
     * @return true if assignable
     */
    public static boolean isAssignable(Type from, Type to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");

        if (from.equals(to)) {
            return true;
        }
        if (from instanceof UnknownType || to instanceof UnknownType) {
            return false;
        }
        if (from.isAny() || to.isAny()) {
            return true;
        }
        if (from == PrimitiveType.DATE && to == PrimitiveType.TIME) {
            return true;
        }
        if (from == PrimitiveType.NUMBER && to == PrimitiveType.CURRENCY) {
            return true;
        }
        if (from instanceof MeasureType && to instanceof MeasureType) {
            return ((MeasureType) to).unit().isEmpty();
        }
        if (from instanceof ArrayType && to instanceof ArrayType) {
            Type fromElem = ((ArrayType) from).elementType();
            return fromElem.isAny() || isAssignable(fromElem, ((ArrayType) to).elementType());
        }
        if (from instanceof EnumType && to instanceof EnumType) {
            EnumType target = (EnumType) to;
            EnumType source = (EnumType) from;
            if (source.entries() == null) {
                return target.entries() == null;
            }
            for (String entry : source.entries()) {
                if (!entry.equals("*") && !target.accepts(entry)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    /**
     * Returns the element type of an array type, or Any for any other type.
     *
     * @param type the type
     * @return the element type
     */
    public static Type elementType(Type type) {
        if (type instanceof ArrayType) {
            return ((ArrayType) type).elementType();
        }
        return PrimitiveType.ANY;
    }
}
