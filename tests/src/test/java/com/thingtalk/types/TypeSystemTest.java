package com.thingtalk.types;

import com.thingtalk.schema.ArgDirection;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for type parsing, structural equality and assignability.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Type System Tests")
public class TypeSystemTest extends TestBase {

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {
            "Boolean", "String", "Number", "Currency", "Date", "Time", "Location",
            "Entity(tt:url)", "Measure(ms)", "Array(String)", "Array(Entity(tt:hashtag))"
        })
        @DisplayName("Printing a parsed type gives back the input")
        void testParsePrintRoundTrip(String typeStr) {
            Type type = TypeParser.parse(typeStr);
            logData("Parsed", type);
            assertThat(type.toString()).isEqualTo(typeStr);
        }

        @Test
        @DisplayName("Primitive types are interned")
        void testPrimitiveInterned() {
            assertThat(TypeParser.parse("Number")).isSameAs(PrimitiveType.NUMBER);
            assertThat(PrimitiveType.forName("String")).isSameAs(PrimitiveType.STRING);
        }

        @Test
        @DisplayName("Parameterized types compare structurally")
        void testStructuralEquality() {
            assertThat(TypeParser.parse("Entity(tt:url)")).isEqualTo(new EntityType("tt:url"));
            assertThat(TypeParser.parse("Measure(C)")).isEqualTo(new MeasureType("C"));
            assertThat(TypeParser.parse("Array(Number)")).isEqualTo(new ArrayType(PrimitiveType.NUMBER));
            assertThat(new EntityType("tt:url")).isNotEqualTo(new EntityType("tt:email_address"));
        }

        @Test
        @DisplayName("Unknown names become unknown types")
        void testUnknownName() {
            assertThat(TypeParser.parse("Frobnicator")).isInstanceOf(UnknownType.class);
        }

        @Test
        @DisplayName("Empty and malformed strings are rejected")
        void testMalformed() {
            assertThatThrownBy(() -> TypeParser.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> TypeParser.parse("Array(String"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Assignability")
    class AssignabilityTests {

        @Test
        @DisplayName("Equal types and Any are assignable")
        void testEqualAndAny() {
            assertThat(Types.isAssignable(PrimitiveType.STRING, PrimitiveType.STRING)).isTrue();
            assertThat(Types.isAssignable(PrimitiveType.ANY, PrimitiveType.NUMBER)).isTrue();
            assertThat(Types.isAssignable(new EntityType("tt:url"), PrimitiveType.ANY)).isTrue();
            assertThat(Types.isAssignable(PrimitiveType.STRING, PrimitiveType.NUMBER)).isFalse();
        }

        @Test
        @DisplayName("Date goes to Time and Number goes to Currency, not back")
        void testWidening() {
            assertThat(Types.isAssignable(PrimitiveType.DATE, PrimitiveType.TIME)).isTrue();
            assertThat(Types.isAssignable(PrimitiveType.TIME, PrimitiveType.DATE)).isFalse();
            assertThat(Types.isAssignable(PrimitiveType.NUMBER, PrimitiveType.CURRENCY)).isTrue();
            assertThat(Types.isAssignable(PrimitiveType.CURRENCY, PrimitiveType.NUMBER)).isFalse();
        }

        @Test
        @DisplayName("Measures need the same unit unless the target has none")
        void testMeasures() {
            assertThat(Types.isAssignable(new MeasureType("ms"), new MeasureType("ms"))).isTrue();
            assertThat(Types.isAssignable(new MeasureType("ms"), new MeasureType("C"))).isFalse();
            assertThat(Types.isAssignable(new MeasureType("ms"), new MeasureType(""))).isTrue();
        }

        @Test
        @DisplayName("Arrays are assignable element-wise")
        void testArrays() {
            assertThat(Types.isAssignable(new ArrayType(PrimitiveType.DATE), new ArrayType(PrimitiveType.TIME)))
                .isTrue();
            assertThat(Types.isAssignable(new ArrayType(PrimitiveType.STRING), new ArrayType(PrimitiveType.NUMBER)))
                .isFalse();
        }

        @Test
        @DisplayName("Enums need every entry accepted by the target")
        void testEnums() {
            EnumType onOff = new EnumType(List.of("on", "off"));
            assertThat(Types.isAssignable(new EnumType(List.of("on")), onOff)).isTrue();
            assertThat(Types.isAssignable(new EnumType(List.of("on", "dim")), onOff)).isFalse();
            assertThat(Types.isAssignable(onOff, new EnumType(List.of("*")))).isTrue();
        }

        @Test
        @DisplayName("Unknown types are only assignable to themselves")
        void testUnknown() {
            assertThat(Types.isAssignable(new UnknownType("foo"), PrimitiveType.ANY)).isFalse();
            assertThat(Types.isAssignable(new UnknownType("foo"), new UnknownType("foo"))).isTrue();
        }
    }

    @Nested
    @DisplayName("Compound types")
    class CompoundTests {

        @Test
        @DisplayName("Fields keep their declaration order")
        void testFieldOrder() {
            Map<String, ArgumentDef> fields = new LinkedHashMap<>();
            fields.put("y", new ArgumentDef(null, "y", PrimitiveType.NUMBER));
            fields.put("x", new ArgumentDef(null, "x", PrimitiveType.NUMBER));
            CompoundType point = new CompoundType(null, fields);

            assertThat(point.fields().keySet()).containsExactly("y", "x");
        }

        @Test
        @DisplayName("Using a compound as an argument does not modify it")
        void testDirectionNotLeaked() {
            Map<String, ArgumentDef> fields = new LinkedHashMap<>();
            fields.put("x", new ArgumentDef(null, "x", PrimitiveType.NUMBER));
            CompoundType point = new CompoundType(null, fields);

            new ArgumentDef(ArgDirection.OUT, "p", point);

            assertThat(point.fields().get("x").direction()).isNull();
        }
    }
}
