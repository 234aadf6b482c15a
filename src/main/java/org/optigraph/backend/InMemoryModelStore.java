package org.optigraph.backend;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.model.constraint.CanonicalConstraint;
import org.optigraph.model.constraint.ConstraintIndex;
import org.optigraph.model.constraint.ConstraintShape;
import org.optigraph.model.expr.VariableExtractor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Heap-backed {@link ModelStore}.
 * <p>
 * Constraint indices are dense per shape. Capabilities come from {@link ModelStoreConfig}.
 * Not thread-safe.
 */
public final class InMemoryModelStore implements ModelStore {

    @Getter
    @Accessors(fluent = true)
    private final ModelStoreConfig config;

    private int numVariables;
    private final Object2IntLinkedOpenHashMap<ConstraintShape> constraintCounts;
    private final Object2ObjectOpenHashMap<ConstraintIndex, Entry> constraints;

    private static final class Entry {
        private final CanonicalConstraint<VariableIndex> constraint;
        private String name = "";

        private Entry(CanonicalConstraint<VariableIndex> constraint) {
            this.constraint = constraint;
        }
    }

    public InMemoryModelStore() {
        this(ModelStoreConfig.allShapes());
    }

    public InMemoryModelStore(ModelStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.constraintCounts = new Object2IntLinkedOpenHashMap<>();
        this.constraints = new Object2ObjectOpenHashMap<>();
    }

    @Override
    public String name() {
        return config.getName();
    }

    @Override
    public VariableIndex addVariable() {
        numVariables++;
        return new VariableIndex(numVariables);
    }

    @Override
    public int numVariables() {
        return numVariables;
    }

    @Override
    public boolean isValid(VariableIndex variable) {
        return variable != null && variable.getValue() <= numVariables;
    }

    @Override
    public boolean supportsConstraint(ConstraintShape shape) {
        return config.supports(shape);
    }

    @Override
    public int numConstraints(ConstraintShape shape) {
        return constraintCounts.getInt(shape);
    }

    @Override
    public void addConstraint(ConstraintIndex index, CanonicalConstraint<VariableIndex> constraint) {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(constraint, "constraint");
        ConstraintShape shape = constraint.getShape();
        if (!supportsConstraint(shape)) {
            throw new UnsupportedShapeException(shape, name());
        }
        if (!shape.equals(index.getShape())) {
            throw new IllegalArgumentException("index shape " + index.getShape() + " does not match constraint shape " + shape);
        }
        int expected = numConstraints(shape) + 1;
        if (index.getValue() != expected) {
            throw new IllegalArgumentException(
                    "constraint indices must be dense: expected " + expected + " but got " + index.getValue());
        }
        for (VariableIndex variable : VariableExtractor.uniqueVariables(constraint.getFunction())) {
            if (!isValid(variable)) {
                throw new MissingVariableException("store " + name() + " has no variable slot " + variable);
            }
        }
        constraints.put(index, new Entry(constraint));
        constraintCounts.addTo(shape, 1);
    }

    @Override
    public boolean isValid(ConstraintIndex index) {
        return index != null && constraints.containsKey(index);
    }

    @Override
    public CanonicalConstraint<VariableIndex> constraint(ConstraintIndex index) {
        return entry(index).constraint;
    }

    @Override
    public void setConstraintName(ConstraintIndex index, String name) {
        entry(index).name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String constraintName(ConstraintIndex index) {
        return entry(index).name;
    }

    @Override
    public List<ConstraintShape> constraintShapes() {
        return new ArrayList<>(constraintCounts.keySet());
    }

    private Entry entry(ConstraintIndex index) {
        Entry entry = constraints.get(index);
        if (entry == null) {
            throw new IllegalArgumentException("Invalid constraint index for store " + name() + ": " + index);
        }
        return entry;
    }
}
