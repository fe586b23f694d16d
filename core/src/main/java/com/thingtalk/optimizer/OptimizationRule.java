package com.thingtalk.optimizer;

import com.thingtalk.expression.BooleanExpression;

/**
 * A rewrite of filter predicates.
 *
 * <p>Rules must preserve the truth table: for every valuation of the atoms,
 * the rewritten predicate evaluates like the original. Rules never mutate
 * their input; unchanged sub-expressions may be shared with the result.
 *
 * <p>Rules are applied iteratively by {@link FilterOptimizer} until no more
 * changes occur, so they should be idempotent.
 */
public interface OptimizationRule {

    /**
     * Applies this rule to a predicate.
     *
     * @param expr the input predicate
     * @return the rewritten predicate, or the input if the rule does not apply
     */
    BooleanExpression apply(BooleanExpression expr);

    /**
     * Returns the name of this rule, used for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
