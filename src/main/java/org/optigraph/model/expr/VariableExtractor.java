package org.optigraph.model.expr;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collects the variables referenced by an expression.
 *
 * <p>Per-variant contract:</p>
 * <ul>
 * <li>{@code CONSTANT}: no variables.</li>
 * <li>{@code VARIABLE}: the variable itself.</li>
 * <li>{@code AFFINE}: every term key, each exactly once.</li>
 * <li>{@code QUADRATIC}: both variables of every quadratic term plus the affine part,
 *     deduplicated in first-seen order.</li>
 * <li>{@code NONLINEAR}: depth-first walk appending variable leaves and recursing into
 *     nonlinear children. Affine, quadratic and constant children are skipped and the
 *     result is <b>not</b> deduplicated; use {@link #uniqueVariables(ScalarExpression)}
 *     when a set is required.</li>
 * </ul>
 */
@UtilityClass
public final class VariableExtractor {

    /**
     * Returns the variables referenced by {@code expression} following the per-variant contract.
     *
     * @param expression expression to inspect.
     * @return variables in first-seen order.
     */
    public static <V> List<V> extractVariables(ScalarExpression<V> expression) {
        Objects.requireNonNull(expression, "expression");
        return switch (expression.kind()) {
            case CONSTANT -> Collections.emptyList();
            case VARIABLE -> List.of(((VariableExpr<V>) expression).getVariable());
            case AFFINE -> extractAffine((AffExpr<V>) expression);
            case QUADRATIC -> extractQuadratic((QuadExpr<V>) expression);
            case NONLINEAR -> extractNonlinear((NonlinearExpr<V>) expression);
        };
    }

    /**
     * Returns the distinct variables referenced by {@code expression}, first-seen order.
     */
    public static <V> Set<V> uniqueVariables(ScalarExpression<V> expression) {
        return new LinkedHashSet<>(extractVariables(expression));
    }

    private static <V> List<V> extractAffine(AffExpr<V> aff) {
        return new ArrayList<>(aff.terms().keySet());
    }

    private static <V> List<V> extractQuadratic(QuadExpr<V> quad) {
        LinkedHashSet<V> vars = new LinkedHashSet<>();
        for (QuadTerm<V> term : quad.getTerms()) {
            vars.add(term.getVariable1());
            vars.add(term.getVariable2());
        }
        vars.addAll(extractAffine(quad.getAff()));
        return new ArrayList<>(vars);
    }

    private static <V> List<V> extractNonlinear(NonlinearExpr<V> expr) {
        List<V> vars = new ArrayList<>();
        for (ScalarExpression<V> arg : expr.getArgs()) {
            if (arg.kind() == ExpressionKind.NONLINEAR) {
                vars.addAll(extractNonlinear((NonlinearExpr<V>) arg));
            } else if (arg.kind() == ExpressionKind.VARIABLE) {
                vars.add(((VariableExpr<V>) arg).getVariable());
            }
        }
        return vars;
    }
}
