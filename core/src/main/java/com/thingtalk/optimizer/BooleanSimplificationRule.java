package com.thingtalk.optimizer;

import com.thingtalk.expression.AndBooleanExpression;
import com.thingtalk.expression.AtomBooleanExpression;
import com.thingtalk.expression.BooleanExpression;
import com.thingtalk.expression.ComputeBooleanExpression;
import com.thingtalk.expression.DontCareBooleanExpression;
import com.thingtalk.expression.ExternalBooleanExpression;
import com.thingtalk.expression.FalseBooleanExpression;
import com.thingtalk.expression.NotBooleanExpression;
import com.thingtalk.expression.OrBooleanExpression;
import com.thingtalk.expression.TrueBooleanExpression;
import com.thingtalk.values.VarRefValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Algebraic simplification of And/Or trees, bottom-up.
 *
 * <p>Transformations:
 * <pre>
 *   And(a, And(b, c))     -> And(a, b, c)
 *   And(true, a)          -> a
 *   And(a, false)         -> false
 *   Or(false, a, false)   -> a
 *   Or(a, true)           -> true
 *   And()                 -> true
 *   Or()                  -> false
 *   !true                 -> false
 *   x == x                -> true
 *   any(q, false)         -> false
 * </pre>
 *
 * <p>Not and External are rewritten inside (the negated operand, the
 * subquery filter) and folded when that becomes a constant. Compute filters
 * and don't-care markers are left as they are.
 */
public class BooleanSimplificationRule implements OptimizationRule {

    @Override
    public BooleanExpression apply(BooleanExpression expr) {
        if (expr instanceof AndBooleanExpression) {
            return simplifyAnd((AndBooleanExpression) expr);
        }
        if (expr instanceof OrBooleanExpression) {
            return simplifyOr((OrBooleanExpression) expr);
        }
        if (expr instanceof NotBooleanExpression) {
            NotBooleanExpression not = (NotBooleanExpression) expr;
            BooleanExpression inner = apply(not.expr());
            if (inner instanceof TrueBooleanExpression) {
                return FalseBooleanExpression.get();
            }
            if (inner instanceof FalseBooleanExpression) {
                return TrueBooleanExpression.get();
            }
            return inner == not.expr() ? not : new NotBooleanExpression(not.location(), inner);
        }
        if (expr instanceof ExternalBooleanExpression) {
            ExternalBooleanExpression external = (ExternalBooleanExpression) expr;
            BooleanExpression filter = apply(external.filter());
            // a true subquery filter does not make the predicate true: the subquery may return nothing
            if (filter instanceof FalseBooleanExpression) {
                return filter;
            }
            if (filter == external.filter()) {
                return external;
            }
            return new ExternalBooleanExpression(external.location(), external.selector(), external.channel(),
                external.inParams(), filter, external.schema());
        }
        if (expr instanceof AtomBooleanExpression) {
            return isTautology((AtomBooleanExpression) expr) ? TrueBooleanExpression.get() : expr;
        }
        if (expr instanceof ComputeBooleanExpression
            || expr instanceof DontCareBooleanExpression
            || expr instanceof TrueBooleanExpression
            || expr instanceof FalseBooleanExpression) {
            return expr;
        }
        throw new IllegalArgumentException("Unknown boolean expression: " + expr.getClass().getSimpleName());
    }

    // x == x, x =~ x, x >= x, x <= x
    private static boolean isTautology(AtomBooleanExpression atom) {
        if (!(atom.value() instanceof VarRefValue) || !((VarRefValue) atom.value()).name().equals(atom.name())) {
            return false;
        }
        switch (atom.operator()) {
            case "==":
            case "=~":
            case ">=":
            case "<=":
                return true;
            default:
                return false;
        }
    }

    private BooleanExpression simplifyAnd(AndBooleanExpression and) {
        List<BooleanExpression> operands = new ArrayList<>();
        for (BooleanExpression operand : and.operands()) {
            BooleanExpression simplified = apply(operand);
            if (simplified instanceof AndBooleanExpression) {
                operands.addAll(((AndBooleanExpression) simplified).operands());
            } else if (simplified instanceof FalseBooleanExpression) {
                return FalseBooleanExpression.get();
            } else if (!(simplified instanceof TrueBooleanExpression)) {
                operands.add(simplified);
            }
        }
        if (operands.isEmpty()) {
            return TrueBooleanExpression.get();
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new AndBooleanExpression(and.location(), operands);
    }

    private BooleanExpression simplifyOr(OrBooleanExpression or) {
        List<BooleanExpression> operands = new ArrayList<>();
        for (BooleanExpression operand : or.operands()) {
            BooleanExpression simplified = apply(operand);
            if (simplified instanceof OrBooleanExpression) {
                operands.addAll(((OrBooleanExpression) simplified).operands());
            } else if (simplified instanceof TrueBooleanExpression) {
                return TrueBooleanExpression.get();
            } else if (!(simplified instanceof FalseBooleanExpression)) {
                operands.add(simplified);
            }
        }
        if (operands.isEmpty()) {
            return FalseBooleanExpression.get();
        }
        if (operands.size() == 1) {
            return operands.get(0);
        }
        return new OrBooleanExpression(or.location(), operands);
    }
}
