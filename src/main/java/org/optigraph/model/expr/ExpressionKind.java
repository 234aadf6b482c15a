package org.optigraph.model.expr;

/**
 * Tag identifying the concrete variant of a {@link ScalarExpression}.
 *
 * <p>Every consumer switches over this tag instead of probing runtime classes, so adding a
 * variant surfaces every switch that must handle it.</p>
 */
public enum ExpressionKind {
    /** Numeric constant leaf. */
    CONSTANT,
    /** Single variable leaf. */
    VARIABLE,
    /** Weighted sum of variables plus a constant. */
    AFFINE,
    /** Sum of bilinear terms plus an affine part. */
    QUADRATIC,
    /** Operator applied to an ordered list of child expressions. */
    NONLINEAR
}
