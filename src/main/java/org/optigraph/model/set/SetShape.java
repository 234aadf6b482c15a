package org.optigraph.model.set;

/**
 * Kind of scalar domain a constraint function is restricted to.
 */
public enum SetShape {
    /** {@code f(x) == value}. */
    EQUAL_TO,
    /** {@code f(x) <= upper}. */
    LESS_THAN,
    /** {@code f(x) >= lower}. */
    GREATER_THAN,
    /** {@code lower <= f(x) <= upper}. */
    INTERVAL
}
