package org.optigraph.model.constraint;

import lombok.Value;

import java.util.Objects;

/**
 * Index typed by constraint shape. Values start at {@code 1} and are dense within one
 * shape namespace.
 */
@Value
public class ConstraintIndex {
    ConstraintShape shape;
    int value;

    public ConstraintIndex(ConstraintShape shape, int value) {
        this.shape = Objects.requireNonNull(shape, "shape");
        if (value < 1) {
            throw new IllegalArgumentException("constraint index must be >= 1, got " + value);
        }
        this.value = value;
    }

    @Override
    public String toString() {
        return "ConstraintIndex" + shape + "(" + value + ")";
    }
}
