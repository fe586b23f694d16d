package com.thingtalk.values;

import com.thingtalk.ast.Node;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.Type;

/**
 * Base class for leaf values of the ThingTalk tree: constants, placeholders
 * and references.
 *
 * <p>Values fall in three groups:
 * <ul>
 *   <li>Constants: boolean, string, number, currency, entity, measure, enum,
 *       time, date, location, recurrent time specification, arg map, array, object, null</li>
 *   <li>References resolved at run time: variable references, events,
 *       context references, filters over values, array fields, computations</li>
 *   <li>The undefined placeholder ({@code $?}), a slot still to be filled</li>
 * </ul>
 *
 * <p>A value is <em>constant</em> if it does not depend on run-time state,
 * and <em>concrete</em> if it can be compiled without external resolution.
 * Two values of different variants are never equal.
 */
public abstract sealed class Value extends Node
    permits BooleanValue, StringValue, NumberValue, CurrencyValue, EntityValue,
            MeasureValue, EnumValue, TimeValue, DateValue, LocationValue,
            RecurrentTimeSpecificationValue, ArgMapValue, ArrayValue, ObjectValue,
            VarRefValue, EventValue, ContextRefValue, UndefinedValue, FilterValue,
            ArrayFieldValue, ComputationValue, NullValue {

    protected Value(SourceRange location) {
        super(location);
    }

    /**
     * Returns the type of this value.
     *
     * <p>References whose type is only known after type checking report Any.
     *
     * @return the type
     */
    public abstract Type getType();

    /**
     * Returns whether this value does not depend on run-time state.
     *
     * @return true if constant
     */
    public boolean isConstant() {
        return isConcrete();
    }

    /**
     * Returns whether this value can be compiled as is, without first being
     * resolved by a dialogue component.
     *
     * @return true if concrete
     */
    public boolean isConcrete() {
        return true;
    }

    /**
     * Returns whether this is the undefined placeholder.
     *
     * @return true for {@link UndefinedValue}
     */
    public boolean isUndefined() {
        return false;
    }

    /**
     * Converts this value to a plain Java object.
     *
     * @return the converted value (Boolean, String, Double, List, Map, java.time types, or null)
     * @throws com.thingtalk.exception.NotConstantException if the value is a run-time reference
     */
    public abstract Object toJS();

    @Override
    public abstract Value clone();

    /**
     * Converts a plain Java object back to a value of the given type.
     *
     * @param type the expected type
     * @param value the Java object, as produced by {@link #toJS()}
     * @return the value
     * @see ValueConverter#fromJS(Type, Object)
     */
    public static Value fromJS(Type type, Object value) {
        return ValueConverter.fromJS(type, value);
    }
}
