package org.optigraph.model.constraint;

import lombok.Value;
import org.optigraph.graph.OptiElement;

import java.util.Objects;

/**
 * Graph-level constraint identity: owning element plus the index allocated in the
 * element's primary backend.
 * <p>
 * The same reference resolves the constraint in every backend that mirrors it, even though
 * each backend stores it under its own local index. Equality follows element identity.
 */
@Value
public class ConstraintRef {
    OptiElement element;
    ConstraintIndex index;
    ValueShape valueShape;

    public ConstraintRef(OptiElement element, ConstraintIndex index, ValueShape valueShape) {
        this.element = Objects.requireNonNull(element, "element");
        this.index = Objects.requireNonNull(index, "index");
        this.valueShape = Objects.requireNonNull(valueShape, "valueShape");
    }

    public ConstraintShape shape() {
        return index.getShape();
    }

    @Override
    public String toString() {
        return element.label() + ":" + index;
    }
}
