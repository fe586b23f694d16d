package com.thingtalk.ast;

import com.thingtalk.expression.AggregationScalarExpression;
import com.thingtalk.expression.AndBooleanExpression;
import com.thingtalk.expression.AtomBooleanExpression;
import com.thingtalk.expression.FalseBooleanExpression;
import com.thingtalk.expression.TrueBooleanExpression;
import com.thingtalk.logical.FilteredTable;
import com.thingtalk.logical.InvocationAction;
import com.thingtalk.logical.InvocationTable;
import com.thingtalk.logical.MonitorStream;
import com.thingtalk.logical.ProjectionTable;
import com.thingtalk.logical.SlicedTable;
import com.thingtalk.logical.SortedTable;
import com.thingtalk.logical.Table;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;
import com.thingtalk.values.NumberValue;
import com.thingtalk.values.StringValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for construction, printing, cloning and traversal of program trees.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Program Tree Tests")
public class ProgramTreeTest extends TestBase {

    private static Invocation search() {
        return new Invocation(new DeviceSelector("com.news", null), "search",
            List.of(new InputParam("query", new StringValue("weather"))));
    }

    private static Invocation say() {
        return new Invocation(BuiltinSelector.get(), "say",
            List.of(new InputParam("message", new StringValue("hi"))));
    }

    private static Table filteredSearch() {
        return new FilteredTable(new InvocationTable(search()),
            new AndBooleanExpression(List.of(
                new AtomBooleanExpression("title", "=~", new StringValue("rain")),
                new AtomBooleanExpression("score", ">=", new NumberValue(3)))));
    }

    @Nested
    @DisplayName("Source printing")
    class SourceTests {

        @Test
        @DisplayName("Invocations print selector, channel and parameters")
        void testInvocation() {
            assertThat(search().toSource()).isEqualTo("@com.news.search(query=\"weather\")");
            assertThat(say().toSource()).isEqualTo("say(message=\"hi\")");
        }

        @Test
        @DisplayName("Filters print after the parenthesized table")
        void testFilteredTable() {
            assertThat(filteredSearch().toSource())
                .isEqualTo("(@com.news.search(query=\"weather\")), title =~ \"rain\" && score >= 3");
        }

        @Test
        @DisplayName("Table operators wrap their operand in parentheses")
        void testTableOperators() {
            Table base = new InvocationTable(search());

            assertThat(new ProjectionTable(base, List.of("title")).toSource())
                .isEqualTo("[title] of (@com.news.search(query=\"weather\"))");
            assertThat(new SortedTable(base, "score", "desc").toSource())
                .isEqualTo("sort score desc of (@com.news.search(query=\"weather\"))");
            assertThat(new SlicedTable(base, new NumberValue(1), new NumberValue(5)).toSource())
                .isEqualTo("(@com.news.search(query=\"weather\"))[1 : 5]");
        }

        @Test
        @DisplayName("Monitor prints its restricted arguments")
        void testMonitor() {
            Table base = new InvocationTable(search());

            assertThat(new MonitorStream(base, null).toSource())
                .isEqualTo("monitor (@com.news.search(query=\"weather\"))");
            assertThat(new MonitorStream(base, List.of("title")).toSource())
                .isEqualTo("monitor (@com.news.search(query=\"weather\")) on new [title]");
        }

        @Test
        @DisplayName("Statements print with their terminators")
        void testStatements() {
            Command command = new Command(new InvocationTable(search()), List.of(new InvocationAction(say())));
            Rule rule = new Rule(new MonitorStream(new InvocationTable(search()), null),
                List.of(new InvocationAction(say())));
            Assignment assignment = new Assignment("news", new InvocationTable(search()));

            assertThat(command.toSource())
                .isEqualTo("now => @com.news.search(query=\"weather\") => say(message=\"hi\");");
            assertThat(rule.toSource())
                .isEqualTo("monitor (@com.news.search(query=\"weather\")) => say(message=\"hi\");");
            assertThat(assignment.toSource())
                .isEqualTo("let result news := @com.news.search(query=\"weather\");");
        }

        @Test
        @DisplayName("Programs print one statement per line")
        void testProgram() {
            Program program = new Program(List.of(
                new Command(null, List.of(new InvocationAction(say()))),
                new Assignment("news", new InvocationTable(search()))));

            assertThat(program.toSource()).isEqualTo(
                "now => say(message=\"hi\");\nlet result news := @com.news.search(query=\"weather\");");
        }

        @Test
        @DisplayName("Count aggregation omits the field")
        void testAggregation() {
            Table base = new InvocationTable(search());

            assertThat(new AggregationScalarExpression("count", null, base).toSource())
                .isEqualTo("count(@com.news.search(query=\"weather\"))");
            assertThat(new AggregationScalarExpression("max", "score", base).toSource())
                .isEqualTo("max(score of @com.news.search(query=\"weather\"))");
        }
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Sort direction must be asc or desc")
        void testSortDirection() {
            assertThatThrownBy(() -> new SortedTable(new InvocationTable(search()), "score", "up"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid sort direction");
        }

        @Test
        @DisplayName("Projection needs at least one argument")
        void testEmptyProjection() {
            assertThatThrownBy(() -> new ProjectionTable(new InvocationTable(search()), Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Aggregations other than count need a field")
        void testAggregationField() {
            assertThatThrownBy(() -> new AggregationScalarExpression("sum", null, new InvocationTable(search())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs a field");
        }

        @Test
        @DisplayName("Commands and rules need an action")
        void testActionsRequired() {
            assertThatThrownBy(() -> new Command(new InvocationTable(search()), Collections.emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Declarations are not accepted as statements")
        void testDeclarationAsStatement() {
            Declaration declaration = new Declaration("q", "query", Collections.emptyMap(),
                new InvocationTable(search()));

            assertThatThrownBy(() -> new Program(List.of(declaration)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Declaration values must match their kind")
        void testDeclarationKind() {
            assertThatThrownBy(() -> new Declaration("q", "action", Collections.emptyMap(),
                new InvocationTable(search())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cannot hold");
            assertThatThrownBy(() -> new Declaration("q", "table", Collections.emptyMap(),
                new InvocationTable(search())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid declaration type");
        }
    }

    @Nested
    @DisplayName("Cloning")
    class CloneTests {

        @Test
        @DisplayName("Clones are equal but independent")
        void testCloneIndependence() {
            Invocation original = search();
            Invocation clone = original.clone();

            assertThat(clone).isEqualTo(original).isNotSameAs(original);

            clone.inParams().get(0).setValue(new StringValue("snow"));
            logData("clone", clone.toSource());

            assertThat(original.toSource()).isEqualTo("@com.news.search(query=\"weather\")");
            assertThat(clone).isNotEqualTo(original);
        }

        @Test
        @DisplayName("Table clones copy the whole tree")
        void testTableClone() {
            Table original = filteredSearch();
            Table clone = original.clone();

            assertThat(clone).isEqualTo(original).isNotSameAs(original);
            assertThat(((FilteredTable) clone).filter()).isNotSameAs(((FilteredTable) original).filter());
        }

        @Test
        @DisplayName("Singletons clone to themselves")
        void testSingletons() {
            assertThat(BuiltinSelector.get()).isSameAs(BuiltinSelector.get());
            assertThat(BuiltinSelector.get().clone()).isSameAs(BuiltinSelector.get());
            assertThat(TrueBooleanExpression.get().clone()).isSameAs(TrueBooleanExpression.get());
            assertThat(FalseBooleanExpression.get().clone()).isSameAs(FalseBooleanExpression.get());
        }
    }

    @Nested
    @DisplayName("Traversal")
    class VisitorTests {

        @Test
        @DisplayName("Visitor sees every node in pre-order")
        void testPreOrder() {
            List<String> seen = new ArrayList<>();
            Command command = new Command(filteredSearch(), List.of(new InvocationAction(say())));

            command.visit(new NodeVisitor() {
                @Override
                public boolean visitInvocation(Invocation node) {
                    seen.add("invocation:" + node.channel());
                    return true;
                }

                @Override
                public boolean visitAtomBooleanExpression(AtomBooleanExpression node) {
                    seen.add("atom:" + node.name());
                    return true;
                }
            });

            logData("seen", seen);
            assertThat(seen).containsExactly("invocation:search", "atom:title", "atom:score", "invocation:say");
        }

        @Test
        @DisplayName("Returning false skips the children")
        void testPrune() {
            List<String> seen = new ArrayList<>();
            Command command = new Command(filteredSearch(), List.of(new InvocationAction(say())));

            command.visit(new NodeVisitor() {
                @Override
                public boolean visitFilteredTable(FilteredTable node) {
                    return false;
                }

                @Override
                public boolean visitInvocation(Invocation node) {
                    seen.add(node.channel());
                    return true;
                }
            });

            assertThat(seen).containsExactly("say");
        }

        @Test
        @DisplayName("Enter and exit bracket each node")
        void testEnterExit() {
            int[] depth = {0};
            int[] maxDepth = {0};
            new Command(filteredSearch(), List.of(new InvocationAction(say()))).visit(new NodeVisitor() {
                @Override
                public void enter(Node node) {
                    depth[0]++;
                    maxDepth[0] = Math.max(maxDepth[0], depth[0]);
                }

                @Override
                public void exit(Node node) {
                    depth[0]--;
                }
            });

            assertThat(depth[0]).isZero();
            assertThat(maxDepth[0]).isGreaterThan(3);
        }
    }
}
