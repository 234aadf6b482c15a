package org.optigraph.model.constraint;

import org.optigraph.model.expr.ExpressionKind;

/**
 * Kind of canonical constraint function. Together with the set shape it partitions
 * the constraint index namespace.
 */
public enum FunctionShape {
    /** A single variable. */
    VARIABLE,
    /** Affine function with its constant folded into the set. */
    AFFINE,
    /** Quadratic function with its constant folded into the set. */
    QUADRATIC,
    /** Nonlinear expression tree. */
    NONLINEAR;

    /**
     * Maps an expression variant to the function shape it is stored under.
     *
     * @param kind expression kind; {@link ExpressionKind#CONSTANT} has no function shape.
     * @return matching function shape.
     */
    public static FunctionShape of(ExpressionKind kind) {
        return switch (kind) {
            case VARIABLE -> VARIABLE;
            case AFFINE -> AFFINE;
            case QUADRATIC -> QUADRATIC;
            case NONLINEAR -> NONLINEAR;
            case CONSTANT -> throw new IllegalArgumentException("Constant expressions have no function shape");
        };
    }
}
