package org.optigraph.model.expr;

import lombok.Value;

import java.util.Objects;
import java.util.function.Function;

/**
 * Single variable leaf.
 */
@Value
public class VariableExpr<V> implements ScalarExpression<V> {
    V variable;

    public VariableExpr(V variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public static <V> VariableExpr<V> of(V variable) {
        return new VariableExpr<>(variable);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.VARIABLE;
    }

    @Override
    public <W> VariableExpr<W> mapVariables(Function<? super V, ? extends W> mapper) {
        return new VariableExpr<>(mapper.apply(variable));
    }

    @Override
    public String toString() {
        return String.valueOf(variable);
    }
}
