package org.optigraph.model.constraint;

import lombok.Value;
import org.optigraph.graph.NodeVariableRef;
import org.optigraph.model.expr.ScalarExpression;
import org.optigraph.model.set.EqualTo;
import org.optigraph.model.set.GreaterThan;
import org.optigraph.model.set.Interval;
import org.optigraph.model.set.LessThan;
import org.optigraph.model.set.ScalarSet;

import java.util.Objects;

/**
 * User-facing constraint {@code function in set} over node variables, before canonicalization.
 */
@Value
public class ScalarConstraint {
    ScalarExpression<NodeVariableRef> function;
    ScalarSet set;

    public ScalarConstraint(ScalarExpression<NodeVariableRef> function, ScalarSet set) {
        this.function = Objects.requireNonNull(function, "function");
        this.set = Objects.requireNonNull(set, "set");
    }

    public static ScalarConstraint lessThan(ScalarExpression<NodeVariableRef> function, double upper) {
        return new ScalarConstraint(function, new LessThan(upper));
    }

    public static ScalarConstraint greaterThan(ScalarExpression<NodeVariableRef> function, double lower) {
        return new ScalarConstraint(function, new GreaterThan(lower));
    }

    public static ScalarConstraint equalTo(ScalarExpression<NodeVariableRef> function, double value) {
        return new ScalarConstraint(function, new EqualTo(value));
    }

    public static ScalarConstraint interval(ScalarExpression<NodeVariableRef> function, double lower, double upper) {
        return new ScalarConstraint(function, new Interval(lower, upper));
    }

    @Override
    public String toString() {
        return function + " " + set;
    }
}
