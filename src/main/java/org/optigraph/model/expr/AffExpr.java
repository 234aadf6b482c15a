package org.optigraph.model.expr;

import it.unimi.dsi.fastutil.objects.Object2DoubleLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMap;
import it.unimi.dsi.fastutil.objects.Object2DoubleMaps;

import java.util.Objects;
import java.util.function.Function;

/**
 * Affine expression {@code sum(a_i * x_i) + b}.
 * <p>
 * Terms are keyed by variable, so each variable appears at most once; adding the same
 * variable twice accumulates its coefficient. Term order is first-insertion order.
 * Instances are immutable; use {@link #builder()} to assemble one.
 */
public final class AffExpr<V> implements ScalarExpression<V> {

    private final Object2DoubleLinkedOpenHashMap<V> terms;
    private final double constant;

    private AffExpr(Object2DoubleLinkedOpenHashMap<V> terms, double constant) {
        this.terms = terms;
        this.constant = constant;
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    /**
     * Shortcut for {@code coefficient * variable}.
     */
    public static <V> AffExpr<V> term(double coefficient, V variable) {
        return AffExpr.<V>builder().addTerm(coefficient, variable).build();
    }

    /**
     * Affine expression with no variable terms.
     */
    public static <V> AffExpr<V> constant(double constant) {
        return AffExpr.<V>builder().constant(constant).build();
    }

    /**
     * Read-only view of variable coefficients in insertion order.
     */
    public Object2DoubleMap<V> terms() {
        return Object2DoubleMaps.unmodifiable(terms);
    }

    public double constant() {
        return constant;
    }

    /**
     * Coefficient of {@code variable}, {@code 0.0} when absent.
     */
    public double coefficient(V variable) {
        return terms.getDouble(variable);
    }

    public int numTerms() {
        return terms.size();
    }

    /**
     * Returns the same terms with a different constant.
     */
    public AffExpr<V> withConstant(double newConstant) {
        return new AffExpr<>(terms, newConstant);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.AFFINE;
    }

    @Override
    public <W> AffExpr<W> mapVariables(Function<? super V, ? extends W> mapper) {
        Builder<W> builder = AffExpr.builder();
        for (Object2DoubleMap.Entry<V> entry : terms.object2DoubleEntrySet()) {
            builder.addTerm(entry.getDoubleValue(), mapper.apply(entry.getKey()));
        }
        return builder.constant(constant).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AffExpr)) {
            return false;
        }
        AffExpr<?> other = (AffExpr<?>) o;
        return Double.compare(constant, other.constant) == 0 && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms, constant);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Object2DoubleMap.Entry<V> entry : terms.object2DoubleEntrySet()) {
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append(entry.getDoubleValue()).append('*').append(entry.getKey());
        }
        if (constant != 0.0d || sb.length() == 0) {
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append(constant);
        }
        return sb.toString();
    }

    /**
     * Mutable accumulator for {@link AffExpr}.
     */
    public static final class Builder<V> {
        private final Object2DoubleLinkedOpenHashMap<V> terms = new Object2DoubleLinkedOpenHashMap<>();
        private double constant;

        private Builder() {
        }

        public Builder<V> addTerm(double coefficient, V variable) {
            Objects.requireNonNull(variable, "variable");
            terms.addTo(variable, coefficient);
            return this;
        }

        public Builder<V> add(AffExpr<V> other) {
            for (Object2DoubleMap.Entry<V> entry : other.terms.object2DoubleEntrySet()) {
                terms.addTo(entry.getKey(), entry.getDoubleValue());
            }
            constant += other.constant;
            return this;
        }

        public Builder<V> constant(double value) {
            this.constant = value;
            return this;
        }

        public Builder<V> addConstant(double value) {
            this.constant += value;
            return this;
        }

        public AffExpr<V> build() {
            return new AffExpr<>(new Object2DoubleLinkedOpenHashMap<>(terms), constant);
        }
    }
}
