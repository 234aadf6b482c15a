package org.optigraph.model.expr;

import lombok.Value;

import java.util.Objects;
import java.util.function.Function;

/**
 * One bilinear term {@code coefficient * variable1 * variable2}.
 */
@Value
public class QuadTerm<V> {
    double coefficient;
    V variable1;
    V variable2;

    public QuadTerm(double coefficient, V variable1, V variable2) {
        this.coefficient = coefficient;
        this.variable1 = Objects.requireNonNull(variable1, "variable1");
        this.variable2 = Objects.requireNonNull(variable2, "variable2");
    }

    <W> QuadTerm<W> mapVariables(Function<? super V, ? extends W> mapper) {
        return new QuadTerm<>(coefficient, mapper.apply(variable1), mapper.apply(variable2));
    }

    @Override
    public String toString() {
        return coefficient + "*" + variable1 + "*" + variable2;
    }
}
