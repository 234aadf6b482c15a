package org.optigraph.registration;

import lombok.experimental.UtilityClass;
import org.optigraph.backend.GraphBackend;
import org.optigraph.graph.OptiElement;
import org.optigraph.model.constraint.ConstraintIndex;
import org.optigraph.model.constraint.ConstraintShape;
import org.optigraph.model.constraint.FunctionShape;
import org.optigraph.model.set.SetShape;

import java.util.Objects;

/**
 * Allocates dense constraint indices per (backend, element, shape).
 * <p>
 * Allocation reads the current count and does not reserve it: the index becomes taken only
 * when the constraint is stored. Callers must not interleave two registrations on one backend.
 */
@UtilityClass
public final class ConstraintIndexAllocator {

    /**
     * Returns {@code count + 1} typed to {@code (f, s)}, where count is the number of
     * constraints of that shape on {@code element} in {@code backend}.
     */
    public static ConstraintIndex nextIndex(GraphBackend backend, OptiElement element, FunctionShape f, SetShape s) {
        return nextIndex(backend, element, ConstraintShape.of(f, s));
    }

    public static ConstraintIndex nextIndex(GraphBackend backend, OptiElement element, ConstraintShape shape) {
        return new ConstraintIndex(shape, numConstraints(backend, element, shape) + 1);
    }

    public static int numConstraints(GraphBackend backend, OptiElement element, FunctionShape f, SetShape s) {
        return numConstraints(backend, element, ConstraintShape.of(f, s));
    }

    public static int numConstraints(GraphBackend backend, OptiElement element, ConstraintShape shape) {
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(element, "element");
        return backend.numConstraints(element, shape);
    }
}
