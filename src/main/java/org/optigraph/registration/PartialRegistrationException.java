package org.optigraph.registration;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.core.OptiGraphException;
import org.optigraph.graph.OptiGraph;
import org.optigraph.model.constraint.ConstraintRef;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a constraint was stored in some containing backends and a later one failed.
 * The updated backends are not rolled back.
 */
@Getter
@Accessors(fluent = true)
public final class PartialRegistrationException extends OptiGraphException {
    public static final String REASON_PARTIAL_REGISTRATION = "OG_PARTIAL_REGISTRATION";

    /** Reference allocated for the constraint. */
    private final ConstraintRef constraintRef;
    /** Graphs whose backends hold the constraint, in registration order. */
    private final List<OptiGraph> succeededGraphs;
    /** Graph whose backend rejected the constraint. */
    private final OptiGraph failedGraph;

    public PartialRegistrationException(
            ConstraintRef constraintRef,
            List<OptiGraph> succeededGraphs,
            OptiGraph failedGraph,
            Throwable cause
    ) {
        super(REASON_PARTIAL_REGISTRATION,
                "constraint " + constraintRef + " stored in " + succeededGraphs
                        + " but rejected by " + failedGraph + ": " + cause.getMessage(),
                cause);
        this.constraintRef = Objects.requireNonNull(constraintRef, "constraintRef");
        this.succeededGraphs = List.copyOf(succeededGraphs);
        this.failedGraph = Objects.requireNonNull(failedGraph, "failedGraph");
    }
}
