package com.thingtalk.values;

import com.thingtalk.exception.NotConstantException;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;
import com.thingtalk.types.ArrayType;
import com.thingtalk.types.EntityType;
import com.thingtalk.types.MeasureType;
import com.thingtalk.types.PrimitiveType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for value types, constant conversion and concreteness.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Value Tests")
public class ValueTest extends TestBase {

    @Nested
    @DisplayName("Types of values")
    class TypeTests {

        @Test
        @DisplayName("Each variant reports its type")
        void testGetType() {
            assertThat(new NumberValue(3).getType()).isSameAs(PrimitiveType.NUMBER);
            assertThat(new StringValue("x").getType()).isSameAs(PrimitiveType.STRING);
            assertThat(new BooleanValue(true).getType()).isSameAs(PrimitiveType.BOOLEAN);
            assertThat(new EntityValue("https://example.com", "tt:url", null).getType())
                .isEqualTo(new EntityType("tt:url"));
            assertThat(new MeasureValue(5, "min").getType()).isEqualTo(new MeasureType("ms"));
        }

        @Test
        @DisplayName("Arrays declare or infer their element type")
        void testArrayType() {
            ArrayValue declared = new ArrayValue(null, List.of(), PrimitiveType.STRING);
            assertThat(declared.getType()).isEqualTo(new ArrayType(PrimitiveType.STRING));

            ArrayValue inferred = new ArrayValue(List.of(new NumberValue(1), new NumberValue(2)));
            assertThat(inferred.getType()).isEqualTo(new ArrayType(PrimitiveType.NUMBER));
        }
    }

    @Nested
    @DisplayName("Conversion to plain objects")
    class ToJSTests {

        @Test
        @DisplayName("Measures convert to the base unit")
        void testMeasureToBaseUnit() {
            assertThat(new MeasureValue(2, "s").toJS()).isEqualTo(2000.0);
        }

        @Test
        @DisplayName("Entities convert to value and display")
        void testEntity() {
            Object js = new EntityValue("bob", "tt:username", "Bob").toJS();
            assertThat(js).isInstanceOf(Map.class);
            @SuppressWarnings("unchecked")
            Map<String, Object> entity = (Map<String, Object>) js;
            assertThat(entity).containsEntry("value", "bob").containsEntry("display", "Bob");
        }

        @Test
        @DisplayName("Variable references are not constants")
        void testVarRefNotConstant() {
            VarRefValue ref = new VarRefValue("title");
            assertThat(ref.isConstant()).isFalse();
            assertThatThrownBy(ref::toJS)
                .isInstanceOf(NotConstantException.class)
                .hasMessageContaining("not a constant");
        }

        @Test
        @DisplayName("Variables with the constant prefix count as constants")
        void testConstantVarRef() {
            assertThat(new VarRefValue("__const_NUMBER_0").isConstant()).isTrue();
        }

        @Test
        @DisplayName("Relative locations cannot be converted")
        void testRelativeLocation() {
            LocationValue home = new LocationValue(new LocationValue.Relative("home"));
            assertThat(home.isConstant()).isTrue();
            assertThat(home.isConcrete()).isFalse();
            assertThatThrownBy(home::toJS).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("fromJS is the inverse of toJS")
        void testFromJS() {
            Value measure = Value.fromJS(new MeasureType("ms"), 1500.0);
            assertThat(measure).isEqualTo(new MeasureValue(1500, "ms"));

            Value array = Value.fromJS(new ArrayType(PrimitiveType.STRING), List.of("a", "b"));
            assertThat(array.toJS()).isEqualTo(List.of("a", "b"));
        }
    }

    @Nested
    @DisplayName("Concreteness")
    class ConcreteTests {

        @Test
        @DisplayName("Undefined and unresolved values are not concrete")
        void testNotConcrete() {
            assertThat(new UndefinedValue().isConcrete()).isFalse();
            assertThat(new UndefinedValue().isUndefined()).isTrue();
            assertThat(new EntityValue(null, "tt:username", "bob").isConcrete()).isFalse();
            assertThat(new MeasureValue(20, "defaultTemperature").isConcrete()).isFalse();
        }

        @Test
        @DisplayName("An array is concrete when all of its elements are")
        void testArrayConcrete() {
            ArrayValue concrete = new ArrayValue(List.of(new NumberValue(1)));
            ArrayValue pending = new ArrayValue(List.of(new NumberValue(1), new UndefinedValue()));
            assertThat(concrete.isConcrete()).isTrue();
            assertThat(pending.isConcrete()).isFalse();
        }
    }

    @Nested
    @DisplayName("Clone and equality")
    class CloneTests {

        @Test
        @DisplayName("Cloned arrays are equal but independent")
        void testArrayCloneIndependent() {
            ArrayValue original = new ArrayValue(List.of(new StringValue("a")));
            ArrayValue copy = original.clone();

            assertThat(copy).isNotSameAs(original).isEqualTo(original);
            copy.values().add(new StringValue("b"));
            assertThat(original.values()).hasSize(1);
        }
    }
}
