package org.optigraph.backend;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.optigraph.model.constraint.ConstraintShape;
import org.optigraph.model.constraint.FunctionShape;
import org.optigraph.model.set.SetShape;

import java.util.EnumSet;
import java.util.Set;

/**
 * Capability configuration for {@link InMemoryModelStore}.
 */
@Value
@Builder
public class ModelStoreConfig {

    /**
     * Store name used in diagnostics.
     */
    @Builder.Default
    String name = "in-memory";

    /**
     * Function shapes the store accepts.
     */
    @Singular
    Set<FunctionShape> supportedFunctions;

    /**
     * Set shapes the store accepts.
     */
    @Singular
    Set<SetShape> supportedSets;

    /**
     * Returns true when both halves of {@code shape} are accepted.
     */
    public boolean supports(ConstraintShape shape) {
        return supportedFunctions.contains(shape.getFunctionShape())
                && supportedSets.contains(shape.getSetShape());
    }

    /**
     * Returns a config accepting every function and set shape.
     */
    public static ModelStoreConfig allShapes() {
        return ModelStoreConfig.builder()
                .supportedFunctions(EnumSet.allOf(FunctionShape.class))
                .supportedSets(EnumSet.allOf(SetShape.class))
                .build();
    }

    /**
     * Returns a config for linear stores: single-variable and affine functions only.
     */
    public static ModelStoreConfig linearOnly() {
        return ModelStoreConfig.builder()
                .name("linear-only")
                .supportedFunction(FunctionShape.VARIABLE)
                .supportedFunction(FunctionShape.AFFINE)
                .supportedSets(EnumSet.allOf(SetShape.class))
                .build();
    }
}
