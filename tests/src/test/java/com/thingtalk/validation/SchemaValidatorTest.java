package com.thingtalk.validation;

import com.thingtalk.ast.BuiltinSelector;
import com.thingtalk.ast.Command;
import com.thingtalk.ast.DeviceSelector;
import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.Invocation;
import com.thingtalk.ast.Program;
import com.thingtalk.exception.TypeCheckException;
import com.thingtalk.expression.AtomBooleanExpression;
import com.thingtalk.expression.TrueBooleanExpression;
import com.thingtalk.logical.FilteredTable;
import com.thingtalk.logical.InvocationAction;
import com.thingtalk.logical.InvocationTable;
import com.thingtalk.logical.Table;
import com.thingtalk.schema.ArgDirection;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.ClassDef;
import com.thingtalk.schema.FunctionDef;
import com.thingtalk.schema.FunctionType;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.values.BooleanValue;
import com.thingtalk.values.StringValue;
import com.thingtalk.values.Value;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for validation of type-checked programs against function signatures.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Schema Validator Tests")
public class SchemaValidatorTest extends TestBase {

    private static FunctionDef lookup(boolean requireFilter) {
        Map<String, Value> annotations = requireFilter
            ? Map.of("require_filter", new BooleanValue(true)) : Map.of();
        FunctionDef lookup = new FunctionDef(null, FunctionType.QUERY, null, "lookup", List.of(), true, false,
            List.of(
                new ArgumentDef(ArgDirection.IN_REQ, "word", PrimitiveType.STRING),
                new ArgumentDef(ArgDirection.IN_OPT, "language", PrimitiveType.STRING),
                new ArgumentDef(ArgDirection.OUT, "definition", PrimitiveType.STRING)),
            Map.of(), annotations);
        new ClassDef("com.dictionary", Map.of("lookup", lookup), Map.of());
        return lookup;
    }

    private static Invocation invocation(FunctionDef schema, InputParam... params) {
        Invocation invocation = new Invocation(new DeviceSelector("com.dictionary", null), "lookup", List.of(params));
        invocation.setSchema(schema);
        return invocation;
    }

    private static InvocationAction notifyAction() {
        FunctionDef notify = new FunctionDef(FunctionType.ACTION, "notify", List.of());
        new ClassDef("org.thingpedia.builtin.thingengine.builtin", Map.of(), Map.of("notify", notify));
        Invocation invocation = new Invocation(BuiltinSelector.get(), "notify", List.of());
        invocation.setSchema(notify);
        return new InvocationAction(invocation);
    }

    private static Program command(Table table) {
        return new Program(List.of(new Command(table, List.of(notifyAction()))));
    }

    @Nested
    @DisplayName("Valid programs")
    class ValidTests {

        @Test
        @DisplayName("Required inputs bound and optional ones omitted")
        void testValidProgram() {
            Invocation lookup = invocation(lookup(false), new InputParam("word", new StringValue("cat")));
            assertThatCode(() -> SchemaValidator.validate(command(new InvocationTable(lookup))))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("A filtered query satisfies require_filter")
        void testRequireFilterSatisfied() {
            Invocation lookup = invocation(lookup(true), new InputParam("word", new StringValue("cat")));
            FilteredTable table = new FilteredTable(new InvocationTable(lookup),
                new AtomBooleanExpression("definition", "=~", new StringValue("animal")));

            assertThatCode(() -> SchemaValidator.validate(command(table))).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Invalid programs")
    class InvalidTests {

        @Test
        @DisplayName("An invocation without schema is rejected")
        void testMissingSchema() {
            Invocation say = new Invocation(BuiltinSelector.get(), "say",
                List.of(new InputParam("message", new StringValue("hi"))));
            Program program = new Program(List.of(new Command(null, List.of(new InvocationAction(say)))));

            assertThatThrownBy(() -> SchemaValidator.validate(program))
                .isInstanceOf(TypeCheckException.class)
                .hasMessageContaining("Missing schema")
                .satisfies(e -> assertThat(((TypeCheckException) e).getPhase()).isEqualTo("schema resolution"));
        }

        @Test
        @DisplayName("Unknown arguments are rejected")
        void testUnknownArgument() {
            Invocation lookup = invocation(lookup(false),
                new InputParam("word", new StringValue("cat")),
                new InputParam("colour", new StringValue("red")));

            assertThatThrownBy(() -> SchemaValidator.validate(command(new InvocationTable(lookup))))
                .isInstanceOf(TypeCheckException.class)
                .hasMessageContaining("Unknown argument colour");
        }

        @Test
        @DisplayName("Output arguments cannot be passed as input")
        void testOutputAsInput() {
            Invocation lookup = invocation(lookup(false),
                new InputParam("word", new StringValue("cat")),
                new InputParam("definition", new StringValue("animal")));

            assertThatThrownBy(() -> SchemaValidator.validate(command(new InvocationTable(lookup))))
                .isInstanceOf(TypeCheckException.class)
                .hasMessageContaining("Output argument definition")
                .satisfies(e -> assertThat(((TypeCheckException) e).getSuggestion()).contains("Filter"));
        }

        @Test
        @DisplayName("Missing required inputs are rejected")
        void testMissingRequired() {
            Invocation lookup = invocation(lookup(false), new InputParam("language", new StringValue("en")));

            assertThatThrownBy(() -> SchemaValidator.validate(command(new InvocationTable(lookup))))
                .isInstanceOf(TypeCheckException.class)
                .hasMessageContaining("Missing required argument word");
        }

        @Test
        @DisplayName("An unfiltered require_filter query is rejected")
        void testRequireFilterMissing() {
            Invocation lookup = invocation(lookup(true), new InputParam("word", new StringValue("cat")));

            assertThatThrownBy(() -> SchemaValidator.validate(command(new InvocationTable(lookup))))
                .isInstanceOf(TypeCheckException.class)
                .hasMessageContaining("requires a filter");
        }

        @Test
        @DisplayName("A constant true filter does not count as a filter")
        void testTrueFilterNotEnough() {
            Invocation lookup = invocation(lookup(true), new InputParam("word", new StringValue("cat")));
            FilteredTable table = new FilteredTable(new InvocationTable(lookup), TrueBooleanExpression.get());

            assertThatThrownBy(() -> SchemaValidator.validate(command(table)))
                .isInstanceOf(TypeCheckException.class)
                .hasMessageContaining("requires a filter");
        }

        @Test
        @DisplayName("The detailed message includes the offending invocation")
        void testDetailedMessage() {
            Invocation lookup = invocation(lookup(false));

            assertThatThrownBy(() -> SchemaValidator.validate(command(new InvocationTable(lookup))))
                .isInstanceOf(TypeCheckException.class)
                .satisfies(e -> assertThat(((TypeCheckException) e).getDetailedMessage())
                    .contains("Phase: input parameter validation")
                    .contains("@com.dictionary.lookup()"));
        }
    }
}
