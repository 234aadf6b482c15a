package org.optigraph.model.expr;

import lombok.Value;

import java.util.function.Function;

/**
 * Numeric constant leaf.
 */
@Value
public class Constant<V> implements ScalarExpression<V> {
    double value;

    public static <V> Constant<V> of(double value) {
        return new Constant<>(value);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CONSTANT;
    }

    @Override
    public <W> Constant<W> mapVariables(Function<? super V, ? extends W> mapper) {
        return new Constant<>(value);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
