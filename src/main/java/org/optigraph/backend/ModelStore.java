package org.optigraph.backend;

import org.optigraph.model.constraint.CanonicalConstraint;
import org.optigraph.model.constraint.ConstraintIndex;
import org.optigraph.model.constraint.ConstraintShape;

import java.util.List;

/**
 * Minimal solver-side store behind a {@link GraphBackend}.
 * <p>
 * The store knows nothing about nodes, edges or graphs. It only holds variable slots and
 * constraints addressed by shape-typed indices. Any implementation honoring this contract
 * can be plugged into a graph.
 */
public interface ModelStore {

    /**
     * Short name used in diagnostics.
     */
    String name();

    /**
     * Creates a new variable slot.
     *
     * @return the slot index, one greater than the previous slot.
     */
    VariableIndex addVariable();

    int numVariables();

    boolean isValid(VariableIndex variable);

    /**
     * Returns true when constraints of {@code shape} can be stored.
     */
    boolean supportsConstraint(ConstraintShape shape);

    /**
     * Number of constraints stored under {@code shape}.
     */
    int numConstraints(ConstraintShape shape);

    /**
     * Stores a constraint at the given index.
     *
     * @param index target index; its shape must match the constraint and its value must be
     *              {@code numConstraints(shape) + 1}.
     * @param constraint constraint over this store's variable slots.
     * @throws UnsupportedShapeException when the shape is not supported.
     * @throws MissingVariableException when the function references an unknown slot.
     */
    void addConstraint(ConstraintIndex index, CanonicalConstraint<VariableIndex> constraint);

    boolean isValid(ConstraintIndex index);

    /**
     * Returns the stored constraint.
     *
     * @throws IllegalArgumentException when the index is not valid.
     */
    CanonicalConstraint<VariableIndex> constraint(ConstraintIndex index);

    void setConstraintName(ConstraintIndex index, String name);

    /**
     * Returns the constraint name, empty when never set.
     */
    String constraintName(ConstraintIndex index);

    /**
     * Distinct shapes with at least one stored constraint, in first-use order.
     */
    List<ConstraintShape> constraintShapes();
}
