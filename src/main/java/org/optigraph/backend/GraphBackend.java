package org.optigraph.backend;

import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.core.id.LocalIdMapper;
import org.optigraph.graph.NodeVariableRef;
import org.optigraph.graph.OptiElement;
import org.optigraph.graph.OptiGraph;
import org.optigraph.model.constraint.CanonicalConstraint;
import org.optigraph.model.constraint.ConstraintIndex;
import org.optigraph.model.constraint.ConstraintRef;
import org.optigraph.model.constraint.ConstraintShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-graph view over a {@link ModelStore}.
 * <p>
 * The backend translates between graph-level identities and the store's local index space:
 * </p>
 * <ul>
 * <li>node variable handles to store variable slots (both directions);</li>
 * <li>graph-level {@link ConstraintRef}s to store constraint indices (both directions);</li>
 * <li>per element, the ordered store indices of its constraints and a counter per
 *     constraint shape.</li>
 * </ul>
 * <p>
 * The same {@link ConstraintRef} may live in several backends under different local indices.
 * Not thread-safe: index allocation is a read-count-then-write sequence, so at most one
 * registration may be in flight per backend.
 * </p>
 */
public final class GraphBackend {
    private static final Logger LOG = LoggerFactory.getLogger(GraphBackend.class);

    @Getter
    @Accessors(fluent = true)
    private final OptiGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final ModelStore store;

    private final LocalIdMapper<NodeVariableRef> variables;
    private final Map<OptiElement, ElementConstraints> elementConstraints;
    private final Object2ObjectOpenHashMap<ConstraintRef, ConstraintIndex> refToLocal;
    private final Object2ObjectOpenHashMap<ConstraintIndex, ConstraintRef> localToRef;

    /**
     * Constraint bookkeeping of one element inside this backend.
     */
    private static final class ElementConstraints {
        private final ObjectArrayList<ConstraintIndex> localIndices = new ObjectArrayList<>();
        private final Object2IntLinkedOpenHashMap<ConstraintShape> counts = new Object2IntLinkedOpenHashMap<>();
    }

    /**
     * Creates a backend for {@code graph} over {@code store}.
     *
     * @param graph graph whose data this backend stores.
     * @param store solver-side store.
     */
    public GraphBackend(OptiGraph graph, ModelStore store) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.store = Objects.requireNonNull(store, "store");
        this.variables = LocalIdMapper.createAppendOnly();
        // elements compare by identity; keep that explicit for the per-element table
        this.elementConstraints = new IdentityHashMap<>();
        this.refToLocal = new Object2ObjectOpenHashMap<>();
        this.localToRef = new Object2ObjectOpenHashMap<>();
    }

    // ========================================================================
    // VARIABLES
    // ========================================================================

    public boolean hasVariable(NodeVariableRef variable) {
        return variables.containsGraph(variable);
    }

    /**
     * Registers a node variable in this backend's local index space.
     *
     * @param variable node variable handle; must not be registered yet.
     * @return the new local slot.
     */
    public VariableIndex addVariable(NodeVariableRef variable) {
        Objects.requireNonNull(variable, "variable");
        if (variables.containsGraph(variable)) {
            throw new IllegalArgumentException(
                    "variable " + variable + " is already registered in backend of graph " + graph.label());
        }
        VariableIndex local = store.addVariable();
        variables.put(variable, local.getValue());
        LOG.debug("graph {}: registered variable {} as {}", graph.label(), variable, local);
        return local;
    }

    /**
     * Returns the local slot of {@code variable}.
     *
     * @throws MissingVariableException when the variable is not registered here.
     */
    public VariableIndex variableIndex(NodeVariableRef variable) {
        if (!variables.containsGraph(variable)) {
            throw new MissingVariableException(
                    "variable " + variable + " is not registered in backend of graph " + graph.label());
        }
        return new VariableIndex(variables.toLocal(variable));
    }

    /**
     * Returns the node variable stored in local slot {@code index}.
     *
     * @throws MissingVariableException when the slot is not mapped to a node variable.
     */
    public NodeVariableRef nodeVariable(VariableIndex index) {
        if (index == null || !variables.containsLocal(index.getValue())) {
            throw new MissingVariableException(
                    "slot " + index + " is not mapped in backend of graph " + graph.label());
        }
        return variables.toGraph(index.getValue());
    }

    public int numVariables() {
        return variables.size();
    }

    /**
     * Node variables known to this backend, in registration order.
     */
    public List<NodeVariableRef> variables() {
        return variables.graphKeys();
    }

    /**
     * Rewrites a graph-level constraint into this backend's local variable slots.
     *
     * @throws MissingVariableException when a referenced variable is not registered here.
     */
    public CanonicalConstraint<VariableIndex> toLocal(CanonicalConstraint<NodeVariableRef> constraint) {
        return constraint.mapVariables(this::variableIndex);
    }

    /**
     * Rewrites a local constraint back into node variable handles.
     */
    public CanonicalConstraint<NodeVariableRef> toGraph(CanonicalConstraint<VariableIndex> constraint) {
        return constraint.mapVariables(this::nodeVariable);
    }

    // ========================================================================
    // CONSTRAINTS
    // ========================================================================

    public boolean supportsConstraint(ConstraintShape shape) {
        return store.supportsConstraint(shape);
    }

    /**
     * Number of constraints of {@code shape} attached to {@code element} in this backend.
     */
    public int numConstraints(OptiElement element, ConstraintShape shape) {
        ElementConstraints table = elementConstraints.get(element);
        return table == null ? 0 : table.counts.getInt(shape);
    }

    /**
     * Distinct constraint shapes attached to {@code element}, in first-use order.
     */
    public List<ConstraintShape> constraintShapes(OptiElement element) {
        ElementConstraints table = elementConstraints.get(element);
        return table == null ? Collections.emptyList() : new ArrayList<>(table.counts.keySet());
    }

    /**
     * Local indices of every constraint attached to {@code element}, in registration order.
     */
    public List<ConstraintIndex> localConstraintIndices(OptiElement element) {
        ElementConstraints table = elementConstraints.get(element);
        return table == null ? Collections.emptyList() : Collections.unmodifiableList(table.localIndices);
    }

    /**
     * Graph-level references of every constraint attached to {@code element}, in registration order.
     */
    public List<ConstraintRef> constraintRefs(OptiElement element) {
        List<ConstraintIndex> locals = localConstraintIndices(element);
        List<ConstraintRef> refs = new ArrayList<>(locals.size());
        for (ConstraintIndex local : locals) {
            refs.add(localToRef.get(local));
        }
        return refs;
    }

    /**
     * Stores a constraint for {@code ref.element()} and records the reference mapping.
     *
     * @param ref graph-level reference.
     * @param elementIndex index of the constraint within the element's namespace in this backend;
     *                     must equal the current count plus one.
     * @param constraint constraint over this backend's variable slots.
     * @param name constraint name, may be empty.
     * @return the store-level index the constraint was placed at.
     */
    public ConstraintIndex addElementConstraint(
            ConstraintRef ref,
            ConstraintIndex elementIndex,
            CanonicalConstraint<VariableIndex> constraint,
            String name
    ) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(elementIndex, "elementIndex");
        Objects.requireNonNull(constraint, "constraint");
        ConstraintShape shape = constraint.getShape();
        if (!store.supportsConstraint(shape)) {
            throw new UnsupportedShapeException(shape, store.name());
        }
        if (refToLocal.containsKey(ref)) {
            throw new IllegalArgumentException(
                    "constraint " + ref + " is already stored in backend of graph " + graph.label());
        }
        int expected = numConstraints(ref.getElement(), shape) + 1;
        if (!elementIndex.getShape().equals(shape) || elementIndex.getValue() != expected) {
            throw new IllegalStateException(
                    "stale element index " + elementIndex + " for " + ref.getElement().label()
                            + " in graph " + graph.label() + "; expected value " + expected);
        }

        ConstraintIndex local = new ConstraintIndex(shape, store.numConstraints(shape) + 1);
        store.addConstraint(local, constraint);
        if (name != null && !name.isEmpty()) {
            store.setConstraintName(local, name);
        }

        refToLocal.put(ref, local);
        localToRef.put(local, ref);
        ElementConstraints table = elementConstraints.computeIfAbsent(ref.getElement(), e -> new ElementConstraints());
        table.localIndices.add(local);
        table.counts.addTo(shape, 1);
        return local;
    }

    public boolean hasConstraint(ConstraintRef ref) {
        return refToLocal.containsKey(ref);
    }

    /**
     * Returns the local index of {@code ref} in this backend.
     *
     * @throws IllegalArgumentException when the constraint is not stored here.
     */
    public ConstraintIndex localIndex(ConstraintRef ref) {
        ConstraintIndex local = refToLocal.get(ref);
        if (local == null) {
            throw new IllegalArgumentException("constraint " + ref + " is not stored in backend of graph " + graph.label());
        }
        return local;
    }

    /**
     * Returns the graph-level reference stored at local index {@code local}.
     *
     * @throws IllegalArgumentException when nothing is stored there.
     */
    public ConstraintRef constraintRef(ConstraintIndex local) {
        ConstraintRef ref = localToRef.get(local);
        if (ref == null) {
            throw new IllegalArgumentException("no constraint at " + local + " in backend of graph " + graph.label());
        }
        return ref;
    }

    /**
     * Constraint of {@code ref} as stored, over local variable slots.
     */
    public CanonicalConstraint<VariableIndex> localConstraint(ConstraintRef ref) {
        return store.constraint(localIndex(ref));
    }

    /**
     * Constraint of {@code ref} mapped back onto node variable handles.
     */
    public CanonicalConstraint<NodeVariableRef> graphConstraint(ConstraintRef ref) {
        return toGraph(localConstraint(ref));
    }

    public String constraintName(ConstraintRef ref) {
        return store.constraintName(localIndex(ref));
    }

    /**
     * Total number of constraints stored in this backend, over all elements.
     */
    public int numConstraints() {
        return refToLocal.size();
    }

    @Override
    public String toString() {
        return "GraphBackend(" + graph.label() + ", " + store.name() + ")";
    }
}
