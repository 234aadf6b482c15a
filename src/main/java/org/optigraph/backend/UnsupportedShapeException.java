package org.optigraph.backend;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.core.OptiGraphException;
import org.optigraph.model.constraint.ConstraintShape;

import java.util.Objects;

/**
 * Thrown when a backend has no registration rule for a constraint shape.
 */
@Getter
@Accessors(fluent = true)
public final class UnsupportedShapeException extends OptiGraphException {
    public static final String REASON_UNSUPPORTED_SHAPE = "OG_UNSUPPORTED_SHAPE";

    private final ConstraintShape shape;

    /**
     * @param shape rejected constraint shape.
     * @param storeName name of the rejecting store, for diagnostics.
     */
    public UnsupportedShapeException(ConstraintShape shape, String storeName) {
        super(REASON_UNSUPPORTED_SHAPE,
                "constraint shape " + Objects.requireNonNull(shape, "shape") + " is not supported by " + storeName);
        this.shape = shape;
    }
}
