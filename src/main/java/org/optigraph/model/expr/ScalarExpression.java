package org.optigraph.model.expr;

import java.util.function.Function;

/**
 * Scalar-valued expression over variables of type {@code V}.
 * <p>
 * The same expression types describe graph-level functions (over node variable handles)
 * and backend-local functions (over backend variable indices). Remapping between the two
 * is a {@link #mapVariables(Function)} call.
 *
 * @param <V> variable handle type.
 */
public interface ScalarExpression<V> {

    /**
     * Returns the variant tag of this expression.
     */
    ExpressionKind kind();

    /**
     * Returns a structurally identical expression with every variable replaced by
     * {@code mapper.apply(variable)}.
     *
     * @param mapper variable mapping; must not return null.
     * @param <W> target variable type.
     * @return remapped expression.
     */
    <W> ScalarExpression<W> mapVariables(Function<? super V, ? extends W> mapper);
}
