package org.optigraph.registration;

import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import lombok.experimental.UtilityClass;
import org.optigraph.graph.NodeVariableRef;
import org.optigraph.model.constraint.CanonicalConstraint;
import org.optigraph.model.constraint.ScalarConstraint;
import org.optigraph.model.expr.AffExpr;
import org.optigraph.model.expr.Constant;
import org.optigraph.model.expr.NonlinearExpr;
import org.optigraph.model.expr.QuadExpr;
import org.optigraph.model.expr.QuadTerm;
import org.optigraph.model.expr.ScalarExpression;
import org.optigraph.model.expr.VariableExpr;
import org.optigraph.model.set.ScalarSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Brings a constraint into canonical function/set form.
 * <ul>
 * <li>Constant, affine and quadratic constants move into the set bound.</li>
 * <li>A constant-only function becomes an affine function without terms.</li>
 * <li>A lone variable stays a single-variable function.</li>
 * <li>Affine and quadratic children of nonlinear trees are rewritten into {@code +} and
 *     {@code *} nodes over variable and constant leaves, so every variable of a canonical
 *     nonlinear function is a leaf reachable through nonlinear nodes.</li>
 * </ul>
 */
@UtilityClass
public final class ConstraintCanonicalizer {

    static final String PLUS = "+";
    static final String TIMES = "*";

    public static CanonicalConstraint<NodeVariableRef> canonicalize(ScalarConstraint constraint) {
        Objects.requireNonNull(constraint, "constraint");
        return canonicalize(constraint.getFunction(), constraint.getSet());
    }

    public static <V> CanonicalConstraint<V> canonicalize(ScalarExpression<V> function, ScalarSet set) {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(set, "set");
        return switch (function.kind()) {
            case CONSTANT -> {
                double value = ((Constant<V>) function).getValue();
                yield new CanonicalConstraint<>(AffExpr.<V>constant(0.0d), set.shift(-value));
            }
            case VARIABLE -> new CanonicalConstraint<>(function, set);
            case AFFINE -> {
                AffExpr<V> aff = (AffExpr<V>) function;
                yield new CanonicalConstraint<>(aff.withConstant(0.0d), set.shift(-aff.constant()));
            }
            case QUADRATIC -> {
                QuadExpr<V> quad = (QuadExpr<V>) function;
                AffExpr<V> aff = quad.getAff();
                yield new CanonicalConstraint<>(quad.withAff(aff.withConstant(0.0d)), set.shift(-aff.constant()));
            }
            case NONLINEAR -> new CanonicalConstraint<>(lowerNonlinear((NonlinearExpr<V>) function), set);
        };
    }

    static <V> NonlinearExpr<V> lowerNonlinear(NonlinearExpr<V> expr) {
        List<ScalarExpression<V>> args = new ArrayList<>(expr.getArgs().size());
        for (ScalarExpression<V> arg : expr.getArgs()) {
            args.add(lowerChild(arg));
        }
        return new NonlinearExpr<>(expr.getHead(), args);
    }

    private static <V> ScalarExpression<V> lowerChild(ScalarExpression<V> arg) {
        return switch (arg.kind()) {
            case CONSTANT, VARIABLE -> arg;
            case AFFINE -> lowerAffine((AffExpr<V>) arg);
            case QUADRATIC -> lowerQuadratic((QuadExpr<V>) arg);
            case NONLINEAR -> lowerNonlinear((NonlinearExpr<V>) arg);
        };
    }

    private static <V> ScalarExpression<V> lowerAffine(AffExpr<V> aff) {
        List<ScalarExpression<V>> summands = new ArrayList<>();
        appendAffine(aff, summands);
        return sum(summands);
    }

    private static <V> ScalarExpression<V> lowerQuadratic(QuadExpr<V> quad) {
        List<ScalarExpression<V>> summands = new ArrayList<>();
        for (QuadTerm<V> term : quad.getTerms()) {
            List<ScalarExpression<V>> factors = new ArrayList<>(3);
            if (term.getCoefficient() != 1.0d) {
                factors.add(Constant.of(term.getCoefficient()));
            }
            factors.add(VariableExpr.of(term.getVariable1()));
            factors.add(VariableExpr.of(term.getVariable2()));
            summands.add(new NonlinearExpr<>(TIMES, factors));
        }
        appendAffine(quad.getAff(), summands);
        return sum(summands);
    }

    private static <V> void appendAffine(AffExpr<V> aff, List<ScalarExpression<V>> summands) {
        for (Object2DoubleMap.Entry<V> entry : aff.terms().object2DoubleEntrySet()) {
            VariableExpr<V> leaf = VariableExpr.of(entry.getKey());
            double coefficient = entry.getDoubleValue();
            if (coefficient == 1.0d) {
                summands.add(leaf);
            } else {
                summands.add(NonlinearExpr.of(TIMES, Constant.<V>of(coefficient), leaf));
            }
        }
        if (aff.constant() != 0.0d) {
            summands.add(Constant.of(aff.constant()));
        }
    }

    private static <V> ScalarExpression<V> sum(List<ScalarExpression<V>> summands) {
        if (summands.isEmpty()) {
            return Constant.of(0.0d);
        }
        if (summands.size() == 1) {
            return summands.get(0);
        }
        return new NonlinearExpr<>(PLUS, summands);
    }
}
