package com.thingtalk.optimizer;

import com.thingtalk.expression.BooleanExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Simplifies filter predicates by applying rewrite rules until a fixed
 * point.
 *
 * <p>Each iteration applies every rule in order; the loop stops when an
 * iteration leaves the predicate unchanged or after the maximum number of
 * iterations.
 *
 * <p>Example usage:
 * <pre>
 *   FilterOptimizer optimizer = new FilterOptimizer();
 *   BooleanExpression simplified = optimizer.optimize(filter);
 * </pre>
 */
public class FilterOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(FilterOptimizer.class);

    private final List<OptimizationRule> rules;
    private final int maxIterations;

    /**
     * Creates an optimizer with the default rules and iteration bound.
     */
    public FilterOptimizer() {
        this(createDefaultRules(), OptimizerConfig.DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Creates an optimizer with custom rules.
     *
     * @param rules the rules to apply, in order
     * @param maxIterations the maximum number of iterations, at least 1
     */
    public FilterOptimizer(List<OptimizationRule> rules, int maxIterations) {
        Objects.requireNonNull(rules, "rules must not be null");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.rules = new ArrayList<>(rules);
        this.maxIterations = maxIterations;
    }

    /**
     * Optimizes a predicate. The input is not modified.
     *
     * @param expr the predicate
     * @return the simplified predicate
     */
    public BooleanExpression optimize(BooleanExpression expr) {
        Objects.requireNonNull(expr, "expr must not be null");

        BooleanExpression current = expr;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            BooleanExpression previous = current;

            for (OptimizationRule rule : rules) {
                BooleanExpression next = rule.apply(current);
                if (next != current && logger.isDebugEnabled()) {
                    logger.debug("{} rewrote {} to {}", rule.name(), current.toSource(), next.toSource());
                }
                current = next;
            }

            if (current == previous || current.equals(previous)) {
                logger.debug("Filter optimization converged after {} iteration(s)", iteration + 1);
                break;
            }
        }
        return current;
    }

    private static List<OptimizationRule> createDefaultRules() {
        return Collections.singletonList(new BooleanSimplificationRule());
    }

    public List<OptimizationRule> rules() {
        return new ArrayList<>(rules);
    }

    public int maxIterations() {
        return maxIterations;
    }
}
