package org.optigraph.model.constraint;

/**
 * Shape of the value a constraint reference evaluates to.
 * Only scalar constraints are modeled.
 */
public enum ValueShape {
    SCALAR
}
