package org.optigraph.model.constraint;

import lombok.Value;
import org.optigraph.model.expr.ScalarExpression;
import org.optigraph.model.set.ScalarSet;

import java.util.Objects;
import java.util.function.Function;

/**
 * Constraint in canonical function/set form, as stored by a backend.
 *
 * @param <V> variable handle type (graph-level or backend-local).
 */
@Value
public class CanonicalConstraint<V> {
    ScalarExpression<V> function;
    ScalarSet set;
    ConstraintShape shape;

    public CanonicalConstraint(ScalarExpression<V> function, ScalarSet set) {
        this.function = Objects.requireNonNull(function, "function");
        this.set = Objects.requireNonNull(set, "set");
        this.shape = ConstraintShape.of(FunctionShape.of(function.kind()), set.shape());
    }

    public <W> CanonicalConstraint<W> mapVariables(Function<? super V, ? extends W> mapper) {
        return new CanonicalConstraint<>(function.mapVariables(mapper), set);
    }
}
