package org.optigraph.model.expr;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Quadratic expression {@code sum(q_k * x_i * x_j) + aff}.
 * <p>
 * Quadratic terms are kept in the order they were written and are not merged, so the same
 * variable pair may appear more than once.
 */
@Value
public class QuadExpr<V> implements ScalarExpression<V> {
    List<QuadTerm<V>> terms;
    AffExpr<V> aff;

    public QuadExpr(List<QuadTerm<V>> terms, AffExpr<V> aff) {
        this.terms = List.copyOf(Objects.requireNonNull(terms, "terms"));
        this.aff = Objects.requireNonNull(aff, "aff");
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.QUADRATIC;
    }

    /**
     * Returns the same quadratic terms over a different affine part.
     */
    public QuadExpr<V> withAff(AffExpr<V> newAff) {
        return new QuadExpr<>(terms, newAff);
    }

    @Override
    public <W> QuadExpr<W> mapVariables(Function<? super V, ? extends W> mapper) {
        List<QuadTerm<W>> mapped = new ArrayList<>(terms.size());
        for (QuadTerm<V> term : terms) {
            mapped.add(term.mapVariables(mapper));
        }
        return new QuadExpr<>(mapped, aff.mapVariables(mapper));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (QuadTerm<V> term : terms) {
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append(term);
        }
        if (aff.numTerms() > 0 || aff.constant() != 0.0d) {
            sb.append(" + ").append(aff);
        }
        return sb.toString();
    }

    /**
     * Mutable accumulator for {@link QuadExpr}.
     */
    public static final class Builder<V> {
        private final List<QuadTerm<V>> terms = new ArrayList<>();
        private final AffExpr.Builder<V> aff = AffExpr.builder();

        private Builder() {
        }

        public Builder<V> addQuadTerm(double coefficient, V variable1, V variable2) {
            terms.add(new QuadTerm<>(coefficient, variable1, variable2));
            return this;
        }

        public Builder<V> addTerm(double coefficient, V variable) {
            aff.addTerm(coefficient, variable);
            return this;
        }

        public Builder<V> constant(double value) {
            aff.constant(value);
            return this;
        }

        public QuadExpr<V> build() {
            return new QuadExpr<>(terms, aff.build());
        }
    }
}
