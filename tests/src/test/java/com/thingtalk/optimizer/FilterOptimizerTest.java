package com.thingtalk.optimizer;

import com.thingtalk.ast.BuiltinSelector;
import com.thingtalk.expression.AndBooleanExpression;
import com.thingtalk.expression.AtomBooleanExpression;
import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.expression.ExternalBooleanExpression;
import com.thingtalk.expression.FalseBooleanExpression;
import com.thingtalk.expression.NotBooleanExpression;
import com.thingtalk.expression.OrBooleanExpression;
import com.thingtalk.expression.TrueBooleanExpression;
import com.thingtalk.test.TestBase;
import com.thingtalk.test.TestCategories;
import com.thingtalk.values.BooleanValue;
import com.thingtalk.values.NumberValue;
import com.thingtalk.values.VarRefValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the boolean filter optimizer.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Rewrite
@DisplayName("Filter Optimizer Tests")
public class FilterOptimizerTest extends TestBase {

    private static final BooleanExpression TRUE = TrueBooleanExpression.get();
    private static final BooleanExpression FALSE = FalseBooleanExpression.get();

    private static BooleanExpression atom(String name) {
        return new AtomBooleanExpression(name, "==", new BooleanValue(true));
    }

    private static BooleanExpression and(BooleanExpression... operands) {
        return new AndBooleanExpression(List.of(operands));
    }

    private static BooleanExpression or(BooleanExpression... operands) {
        return new OrBooleanExpression(List.of(operands));
    }

    private static BooleanExpression not(BooleanExpression expr) {
        return new NotBooleanExpression(expr);
    }

    /** Evaluates a filter built from atoms, constants and connectives. */
    private static boolean evaluate(BooleanExpression expr, Map<String, Boolean> valuation) {
        if (expr instanceof TrueBooleanExpression) {
            return true;
        }
        if (expr instanceof FalseBooleanExpression) {
            return false;
        }
        if (expr instanceof AtomBooleanExpression) {
            return valuation.get(((AtomBooleanExpression) expr).name());
        }
        if (expr instanceof NotBooleanExpression) {
            return !evaluate(((NotBooleanExpression) expr).expr(), valuation);
        }
        if (expr instanceof AndBooleanExpression) {
            return ((AndBooleanExpression) expr).operands().stream().allMatch(op -> evaluate(op, valuation));
        }
        if (expr instanceof OrBooleanExpression) {
            return ((OrBooleanExpression) expr).operands().stream().anyMatch(op -> evaluate(op, valuation));
        }
        throw new AssertionError("Unexpected expression " + expr);
    }

    static Stream<BooleanExpression> expressions() {
        return Stream.of(
            and(TRUE, atom("p")),
            or(FALSE, atom("p"), and(atom("q"), TRUE)),
            and(atom("p"), or(atom("q"), atom("r")), and(atom("r"), TRUE)),
            not(and(TRUE, or(FALSE, atom("p")))),
            or(and(), atom("q")),
            and(or(), atom("q")),
            not(not(or(atom("p"), FALSE))),
            and(and(atom("p"), and(atom("q"), and(atom("r")))), or(TRUE, atom("p"))),
            or(or(or(FALSE)), not(TRUE), atom("r"))
        );
    }

    @Nested
    @DisplayName("Simplification")
    class SimplificationTests {

        private final FilterOptimizer optimizer = new FilterOptimizer();

        @Test
        @DisplayName("True is dropped from a conjunction with one other operand")
        void testAndWithTrue() {
            BooleanExpression p = new AtomBooleanExpression("p", "==", new NumberValue(3));
            BooleanExpression result = optimizer.optimize(and(TRUE, p));
            assertThat(result).isEqualTo(new AtomBooleanExpression("p", "==", new NumberValue(3)));
        }

        @Test
        @DisplayName("A disjunction of falses is false")
        void testOrOfFalse() {
            assertThat(optimizer.optimize(or(FALSE, FALSE))).isSameAs(FALSE);
        }

        @Test
        @DisplayName("Empty conjunction is true and empty disjunction is false")
        void testEmpty() {
            assertThat(optimizer.optimize(and())).isSameAs(TRUE);
            assertThat(optimizer.optimize(or())).isSameAs(FALSE);
        }

        @Test
        @DisplayName("False absorbs a conjunction and true absorbs a disjunction")
        void testAbsorbing() {
            assertThat(optimizer.optimize(and(atom("p"), FALSE, atom("q")))).isSameAs(FALSE);
            assertThat(optimizer.optimize(or(atom("p"), TRUE))).isSameAs(TRUE);
        }

        @Test
        @DisplayName("Nested conjunctions are flattened")
        void testFlatten() {
            BooleanExpression result = optimizer.optimize(and(atom("p"), and(atom("q"), atom("r"))));
            assertThat(result).isEqualTo(and(atom("p"), atom("q"), atom("r")));
        }

        @Test
        @DisplayName("Negated constants are folded")
        void testNotConstant() {
            assertThat(optimizer.optimize(not(TRUE))).isSameAs(FALSE);
            assertThat(optimizer.optimize(not(and(FALSE)))).isSameAs(TRUE);
        }

        @Test
        @DisplayName("Comparing a parameter with itself is always true")
        void testTautology() {
            BooleanExpression self = new AtomBooleanExpression("p", ">=", new VarRefValue("p"));
            BooleanExpression other = new AtomBooleanExpression("p", ">=", new VarRefValue("q"));
            assertThat(optimizer.optimize(self)).isSameAs(TRUE);
            assertThat(optimizer.optimize(other)).isEqualTo(other);
        }

        @Test
        @DisplayName("A subquery with a false filter is false, one with a true filter is kept")
        void testExternal() {
            BooleanExpression never = new ExternalBooleanExpression(BuiltinSelector.get(), "get", List.of(),
                and(atom("p"), FALSE));
            BooleanExpression always = new ExternalBooleanExpression(BuiltinSelector.get(), "get", List.of(),
                or(atom("p"), TRUE));

            assertThat(optimizer.optimize(never)).isSameAs(FALSE);
            BooleanExpression kept = optimizer.optimize(always);
            assertThat(kept).isInstanceOf(ExternalBooleanExpression.class);
            assertThat(((ExternalBooleanExpression) kept).filter()).isSameAs(TRUE);
        }

        @Test
        @DisplayName("The input expression is left untouched")
        void testInputNotMutated() {
            BooleanExpression input = and(TRUE, or(atom("p"), FALSE));
            BooleanExpression snapshot = input.clone();

            optimizer.optimize(input);

            assertThat(input).isEqualTo(snapshot);
        }

        @Test
        @DisplayName("optimize() on an expression uses the default optimizer")
        void testOptimizeShortcut() {
            assertThat(and(TRUE, atom("p")).optimize()).isEqualTo(atom("p"));
        }
    }

    @Nested
    @DisplayName("Semantics preservation")
    class SemanticsTests {

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("com.thingtalk.optimizer.FilterOptimizerTest#expressions")
        @DisplayName("Every valuation gives the same result before and after optimizing")
        void testTruthTable(BooleanExpression expr) {
            BooleanExpression optimized = new FilterOptimizer().optimize(expr);
            logData("Optimized", optimized.toSource());

            String[] names = { "p", "q", "r" };
            for (int bits = 0; bits < 8; bits++) {
                Map<String, Boolean> valuation = new HashMap<>();
                for (int i = 0; i < names.length; i++) {
                    valuation.put(names[i], (bits & (1 << i)) != 0);
                }
                assertThat(evaluate(optimized, valuation))
                    .as("valuation %s of %s", valuation, expr.toSource())
                    .isEqualTo(evaluate(expr, valuation));
            }
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Default optimizer runs boolean simplification with the default bound")
        void testDefaults() {
            FilterOptimizer optimizer = new FilterOptimizer();
            assertThat(optimizer.maxIterations()).isEqualTo(OptimizerConfig.DEFAULT_MAX_ITERATIONS);
            assertThat(optimizer.rules()).hasSize(1);
            assertThat(optimizer.rules().get(0)).isInstanceOf(BooleanSimplificationRule.class);
        }

        @Test
        @DisplayName("At least one iteration is required")
        void testInvalidIterations() {
            assertThatThrownBy(() -> new FilterOptimizer(List.of(new BooleanSimplificationRule()), 0))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Custom rules are applied")
        void testCustomRule() {
            OptimizationRule everythingTrue = expr -> TRUE;
            FilterOptimizer optimizer = new FilterOptimizer(List.of(everythingTrue), 3);
            assertThat(optimizer.optimize(atom("p"))).isSameAs(TRUE);
        }
    }
}
