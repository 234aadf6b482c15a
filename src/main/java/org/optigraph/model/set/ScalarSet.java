package org.optigraph.model.set;

/**
 * Scalar domain of a constraint.
 */
public interface ScalarSet {

    SetShape shape();

    /**
     * Returns this set with every bound moved by {@code delta}.
     * Used to fold a function constant into the set: {@code f + c in S} becomes
     * {@code f in shift(S, -c)}.
     */
    ScalarSet shift(double delta);
}
