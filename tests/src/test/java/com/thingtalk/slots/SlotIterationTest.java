package com.thingtalk.slots;

import com.thingtalk.ast.BuiltinSelector;
import com.thingtalk.ast.Command;
import com.thingtalk.ast.DeviceSelector;
import com.thingtalk.ast.InputParam;
import com.thingtalk.ast.Invocation;
import com.thingtalk.ast.Program;
import com.thingtalk.expression.AndBooleanExpression;
import com.thingtalk.expression.AtomBooleanExpression;
import com.thingtalk.expression.ExternalBooleanExpression;
import com.thingtalk.logical.FilteredTable;
import com.thingtalk.logical.InvocationAction;
import com.thingtalk.logical.InvocationTable;
import com.thingtalk.logical.JoinTable;
import com.thingtalk.schema.ArgDirection;
import com.thingtalk.schema.ArgumentDef;
import com.thingtalk.schema.ClassDef;
import com.thingtalk.schema.FunctionDef;
import com.thingtalk.schema.FunctionType;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.values.ArrayValue;
import com.thingtalk.values.EntityValue;
import com.thingtalk.values.NumberValue;
import com.thingtalk.values.StringValue;
import com.thingtalk.values.UndefinedValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for slot iteration: order, tags, scopes and write-through.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Slot Iteration Tests")
public class SlotIterationTest extends TestBase {

    private static FunctionDef search() {
        FunctionDef search = new FunctionDef(null, FunctionType.QUERY, null, "search", List.of(), true, false,
            List.of(
                new ArgumentDef(ArgDirection.IN_REQ, "query", PrimitiveType.STRING),
                new ArgumentDef(ArgDirection.IN_OPT, "count", PrimitiveType.NUMBER),
                new ArgumentDef(ArgDirection.OUT, "title", PrimitiveType.STRING),
                new ArgumentDef(ArgDirection.OUT, "score", PrimitiveType.NUMBER)),
            Map.of(), Map.of());
        new ClassDef("com.example", Map.of("search", search), Map.of());
        return search;
    }

    private static FunctionDef say() {
        FunctionDef say = new FunctionDef(null, FunctionType.ACTION, null, "say", List.of(), false, false,
            List.of(new ArgumentDef(ArgDirection.IN_REQ, "message", PrimitiveType.STRING)),
            Map.of(), Map.of());
        new ClassDef("org.thingpedia.builtin.thingengine.builtin", Map.of(), Map.of("say", say));
        return say;
    }

    private static Invocation searchInvocation() {
        DeviceSelector device = new DeviceSelector(null, "com.example", null,
            List.of(new InputParam("name", new StringValue("work"))), false);
        Invocation invocation = new Invocation(device, "search", List.of(
            new InputParam("query", new StringValue("cats")),
            new InputParam("count", new NumberValue(3))));
        invocation.setSchema(search());
        return invocation;
    }

    private static FunctionDef lookup() {
        FunctionDef lookup = new FunctionDef(null, FunctionType.QUERY, null, "lookup", List.of(), true, false,
            List.of(
                new ArgumentDef(ArgDirection.IN_REQ, "word", PrimitiveType.STRING),
                new ArgumentDef(ArgDirection.OUT, "definition", PrimitiveType.STRING)),
            Map.of(), Map.of());
        new ClassDef("com.dictionary", Map.of("lookup", lookup), Map.of());
        return lookup;
    }

    private static List<String> tags(List<SlotItem> slots) {
        List<String> tags = new ArrayList<>();
        for (SlotItem slot : slots) {
            tags.add(slot instanceof AbstractSlot ? ((AbstractSlot) slot).tag() : "selector");
        }
        return tags;
    }

    @Nested
    @DisplayName("Invocations")
    class InvocationTests {

        @Test
        @DisplayName("Attribute, then selector, then input parameters")
        void testInvocationOrder() {
            logStep("Given: a device invocation with one attribute and two input parameters");
            Invocation invocation = searchInvocation();

            logStep("When: iterating its slots twice");
            List<SlotItem> first = new ArrayList<>();
            invocation.iterateSlots2(Collections.emptyMap(), first);
            List<SlotItem> second = new ArrayList<>();
            invocation.iterateSlots2(Collections.emptyMap(), second);

            logStep("Then: the order is fixed");
            assertThat(first).hasSize(4);
            assertThat(first.get(0)).isInstanceOf(DeviceAttributeSlot.class);
            assertThat(first.get(1)).isSameAs(invocation.selector());
            assertThat(first.get(2)).isInstanceOf(InputParamSlot.class);
            assertThat(first.get(3)).isInstanceOf(InputParamSlot.class);
            assertThat(((AbstractSlot) first.get(0)).tag()).isEqualTo("attribute.name");
            assertThat(((AbstractSlot) first.get(2)).tag()).isEqualTo("in_param.query");
            assertThat(((AbstractSlot) first.get(3)).tag()).isEqualTo("in_param.count");

            assertThat(second).hasSameSizeAs(first);
            for (int i = 0; i < first.size(); i++) {
                assertThat(second.get(i).getClass()).isEqualTo(first.get(i).getClass());
            }
        }

        @Test
        @DisplayName("Input parameter slots are typed by the schema")
        void testSlotTypes() {
            List<SlotItem> slots = new ArrayList<>();
            searchInvocation().iterateSlots2(Collections.emptyMap(), slots);

            assertThat(((AbstractSlot) slots.get(2)).type()).isSameAs(PrimitiveType.STRING);
            assertThat(((AbstractSlot) slots.get(3)).type()).isSameAs(PrimitiveType.NUMBER);
        }

        @Test
        @DisplayName("Setting a slot writes into the tree")
        void testSlotWriteThrough() {
            Invocation invocation = searchInvocation();
            List<SlotItem> slots = new ArrayList<>();
            invocation.iterateSlots2(Collections.emptyMap(), slots);

            ((AbstractSlot) slots.get(2)).set(new StringValue("dogs"));

            assertThat(invocation.inParams().get(0).value()).isEqualTo(new StringValue("dogs"));
        }

        @Test
        @DisplayName("Array values yield one extra slot per element")
        void testArrayElements() {
            Invocation invocation = new Invocation(BuiltinSelector.get(), "say", List.of(
                new InputParam("message", new ArrayValue(List.of(new StringValue("a"), new StringValue("b"))))));
            List<SlotItem> slots = new ArrayList<>();
            invocation.iterateSlots2(Collections.emptyMap(), slots);

            assertThat(slots).hasSize(3);
            assertThat(slots.get(1)).isInstanceOf(ArrayIndexSlot.class);
            assertThat(slots.get(2)).isInstanceOf(ArrayIndexSlot.class);
        }

        @Test
        @DisplayName("The output scope lists outputs and the event")
        void testOutputScope() {
            SlotScope scope = searchInvocation().iterateSlots2(Collections.emptyMap(), new ArrayList<>());

            assertThat(scope.scope()).containsOnlyKeys("title", "score", "$event");
            assertThat(scope.primitive()).isNotNull();
        }
    }

    @Nested
    @DisplayName("Programs")
    class ProgramTests {

        @Test
        @DisplayName("Principal, then query, then filter, then action")
        void testCommandOrder() {
            logStep("Given: executor = bob : now => search(), title =~ \"x\" && score >= 2 => say(message=$?)");
            FilteredTable table = new FilteredTable(new InvocationTable(searchInvocation()),
                new AndBooleanExpression(List.of(
                    new AtomBooleanExpression("title", "=~", new StringValue("x")),
                    new AtomBooleanExpression("score", ">=", new NumberValue(2)))));
            Invocation sayInvocation = new Invocation(BuiltinSelector.get(), "say",
                List.of(new InputParam("message", new UndefinedValue())));
            sayInvocation.setSchema(say());
            Program program = new Program(null, List.of(), List.of(),
                List.of(new Command(table, List.of(new InvocationAction(sayInvocation)))),
                new EntityValue("bob", "tt:contact", null));

            List<SlotItem> slots = program.iterateSlots2();
            List<String> tags = new ArrayList<>();
            for (SlotItem slot : slots) {
                tags.add(slot instanceof AbstractSlot ? ((AbstractSlot) slot).tag() : "selector");
            }
            logData("Tags", tags);

            assertThat(tags).containsExactly(
                "program.principal",
                "attribute.name", "selector", "in_param.query", "in_param.count",
                "filter.=~.title", "filter.>=.score",
                "in_param.message");
        }

        @Test
        @DisplayName("Action parameters can use the outputs of the query")
        void testActionScope() {
            Invocation sayInvocation = new Invocation(BuiltinSelector.get(), "say",
                List.of(new InputParam("message", new UndefinedValue())));
            sayInvocation.setSchema(say());
            Program program = new Program(List.of(new Command(new InvocationTable(searchInvocation()),
                List.of(new InvocationAction(sayInvocation)))));

            List<SlotItem> slots = program.iterateSlots2();
            AbstractSlot message = (AbstractSlot) slots.get(slots.size() - 1);

            assertThat(message.isUndefined()).isTrue();
            assertThat(message.scope()).containsKeys("title", "score");
            assertThat(message.options()).extracting(entry -> entry.value().toSource())
                .contains("title")
                .doesNotContain("score");
        }

        @Test
        @DisplayName("Filters cannot compare a parameter with itself")
        void testFilterExcludesSelf() {
            FilteredTable table = new FilteredTable(new InvocationTable(searchInvocation()),
                new AtomBooleanExpression("title", "==", new UndefinedValue()));
            List<SlotItem> slots = new ArrayList<>();
            table.iterateSlots2(Collections.emptyMap(), slots);

            AbstractSlot filter = (AbstractSlot) slots.get(slots.size() - 1);
            assertThat(filter.options()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Subqueries and joins")
    class NestedQueryTests {

        @Test
        @DisplayName("A subquery yields its attributes and selector before its parameters")
        void testExternalOrder() {
            logStep("Given: search(), any(@com.dictionary(name=\"home\").lookup(word=\"cat\"), definition == $?)");
            DeviceSelector dictionary = new DeviceSelector(null, "com.dictionary", null,
                List.of(new InputParam("name", new StringValue("home"))), false);
            ExternalBooleanExpression subquery = new ExternalBooleanExpression(dictionary, "lookup",
                List.of(new InputParam("word", new StringValue("cat"))),
                new AtomBooleanExpression("definition", "==", new UndefinedValue()));
            subquery.setSchema(lookup());
            FilteredTable table = new FilteredTable(new InvocationTable(searchInvocation()), subquery);

            List<SlotItem> slots = new ArrayList<>();
            table.iterateSlots2(Collections.emptyMap(), slots);
            logData("Tags", tags(slots));

            assertThat(tags(slots)).containsExactly(
                "attribute.name", "selector", "in_param.query", "in_param.count",
                "attribute.name", "selector", "in_param.word", "filter.==.definition");
            assertThat(slots.get(5)).isSameAs(dictionary);
            assertThat(((AbstractSlot) slots.get(4)).get()).isEqualTo(new StringValue("home"));
        }

        @Test
        @DisplayName("The right side of a join follows the left and sees its outputs")
        void testJoinOrder() {
            Invocation define = new Invocation(new DeviceSelector("com.dictionary", null), "lookup",
                List.of(new InputParam("word", new UndefinedValue())));
            define.setSchema(lookup());
            JoinTable join = new JoinTable(new InvocationTable(searchInvocation()), new InvocationTable(define),
                List.of());

            List<SlotItem> slots = new ArrayList<>();
            SlotScope result = join.iterateSlots2(Collections.emptyMap(), slots);
            logData("Tags", tags(slots));

            assertThat(tags(slots)).containsExactly(
                "attribute.name", "selector", "in_param.query", "in_param.count",
                "selector", "in_param.word");
            AbstractSlot word = (AbstractSlot) slots.get(slots.size() - 1);
            assertThat(word.scope()).containsKeys("title", "score");
            assertThat(result.primitive()).isNull();
            assertThat(result.scope()).containsKeys("title", "score", "definition");
        }
    }
}
