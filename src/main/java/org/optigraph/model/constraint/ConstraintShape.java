package org.optigraph.model.constraint;

import lombok.Value;
import org.optigraph.model.set.SetShape;

import java.util.Objects;

/**
 * The (function shape, set shape) pair classifying a constraint for indexing.
 */
@Value
public class ConstraintShape {
    FunctionShape functionShape;
    SetShape setShape;

    public ConstraintShape(FunctionShape functionShape, SetShape setShape) {
        this.functionShape = Objects.requireNonNull(functionShape, "functionShape");
        this.setShape = Objects.requireNonNull(setShape, "setShape");
    }

    public static ConstraintShape of(FunctionShape functionShape, SetShape setShape) {
        return new ConstraintShape(functionShape, setShape);
    }

    @Override
    public String toString() {
        return "(" + functionShape + ", " + setShape + ")";
    }
}
