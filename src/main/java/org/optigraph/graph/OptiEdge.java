package org.optigraph.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.backend.GraphBackend;
import org.optigraph.model.constraint.ConstraintRef;
import org.optigraph.model.constraint.ConstraintShape;
import org.optigraph.model.constraint.FunctionShape;
import org.optigraph.model.constraint.ScalarConstraint;
import org.optigraph.model.expr.ScalarExpression;
import org.optigraph.model.expr.VariableExtractor;
import org.optigraph.model.set.ScalarSet;
import org.optigraph.model.set.SetShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Coupling between nodes that owns linking constraints.
 * <p>
 * An edge is created once by {@link OptiGraph#addEdge(String, OptiNode...)} and is immutable as
 * an identity afterwards; only its object dictionary and its registered constraints grow.
 * Constraints are stored in the backend of every graph returned by {@link #containingGraphs()}.
 * Query methods read the primary backend.
 * </p>
 */
public final class OptiEdge implements OptiElement {

    @Getter
    @Accessors(fluent = true)
    private final OptiGraph sourceGraph;
    @Getter
    @Accessors(fluent = true)
    private final String label;

    private final Set<OptiNode> nodes;
    private final Map<String, Object> objects = new LinkedHashMap<>();

    OptiEdge(OptiGraph sourceGraph, String label, Set<OptiNode> nodes) {
        this.sourceGraph = Objects.requireNonNull(sourceGraph, "sourceGraph");
        this.label = Objects.requireNonNull(label, "label");
        this.nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
    }

    /**
     * Coupled nodes in declaration order, without duplicates.
     */
    public Set<OptiNode> nodes() {
        return nodes;
    }

    /**
     * Returns the optimizer graph followed by every graph that mirrors this edge,
     * in mirror registration order.
     */
    @Override
    public List<OptiGraph> containingGraphs() {
        List<OptiGraph> graphs = new ArrayList<>();
        graphs.add(optimizerGraph());
        graphs.addAll(sourceGraph.mirrorGraphs(this));
        return Collections.unmodifiableList(graphs);
    }

    // ========================================================================
    // OBJECT DICTIONARY
    // ========================================================================

    /**
     * Stores {@code value} under {@code name}. An existing entry is overwritten.
     */
    public void set(String name, Object value) {
        objects.put(Objects.requireNonNull(name, "name"), value);
    }

    /**
     * Returns the object stored under {@code name}.
     *
     * @throws UnknownObjectException when {@code name} was never set on this edge.
     */
    public Object get(String name) {
        if (!objects.containsKey(name)) {
            throw new UnknownObjectException(label, name);
        }
        return objects.get(name);
    }

    /**
     * Typed variant of {@link #get(String)}.
     *
     * @throws ClassCastException when the stored object is not a {@code type}.
     */
    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public boolean hasObject(String name) {
        return objects.containsKey(name);
    }

    /**
     * Read-only view of the object dictionary.
     */
    public Map<String, Object> objectDictionary() {
        return Collections.unmodifiableMap(objects);
    }

    // ========================================================================
    // CONSTRAINTS
    // ========================================================================

    /**
     * Adds an unnamed linking constraint.
     *
     * @see #addConstraint(ScalarConstraint, String)
     */
    public ConstraintRef addConstraint(ScalarConstraint constraint) {
        return addConstraint(constraint, "");
    }

    /**
     * Adds a linking constraint and mirrors it into every containing backend.
     *
     * @param constraint constraint over node variables.
     * @param name constraint name, may be empty.
     * @return graph-level reference valid against every containing backend.
     */
    public ConstraintRef addConstraint(ScalarConstraint constraint, String name) {
        return sourceGraph.registrar().addConstraint(this, constraint, name);
    }

    /**
     * Distinct constraint shapes present on this edge, in first-use order.
     */
    public List<ConstraintShape> listConstraintTypes() {
        return graphBackend().constraintShapes(this);
    }

    /**
     * Constraints of exactly shape {@code (f, s)}, in allocation order.
     */
    public List<ConstraintRef> listConstraints(FunctionShape f, SetShape s) {
        ConstraintShape shape = ConstraintShape.of(f, s);
        List<ConstraintRef> refs = new ArrayList<>();
        for (ConstraintRef ref : graphBackend().constraintRefs(this)) {
            if (ref.shape().equals(shape)) {
                refs.add(ref);
            }
        }
        return refs;
    }

    public int numConstraints(FunctionShape f, SetShape s) {
        return graphBackend().numConstraints(this, ConstraintShape.of(f, s));
    }

    /**
     * Every constraint on this edge, in allocation order.
     */
    public List<ConstraintRef> allConstraints() {
        return graphBackend().constraintRefs(this);
    }

    /**
     * Distinct node variables referenced by the constraints of this edge.
     */
    public List<NodeVariableRef> allVariables() {
        GraphBackend backend = graphBackend();
        LinkedHashSet<NodeVariableRef> vars = new LinkedHashSet<>();
        for (ConstraintRef ref : backend.constraintRefs(this)) {
            vars.addAll(VariableExtractor.extractVariables(backend.graphConstraint(ref).getFunction()));
        }
        return new ArrayList<>(vars);
    }

    /**
     * Canonical function of {@code ref} over node variables.
     */
    public ScalarExpression<NodeVariableRef> constraintFunction(ConstraintRef ref) {
        return graphBackend().graphConstraint(requireOwn(ref)).getFunction();
    }

    /**
     * Canonical set of {@code ref}.
     */
    public ScalarSet constraintSet(ConstraintRef ref) {
        return graphBackend().localConstraint(requireOwn(ref)).getSet();
    }

    public String constraintName(ConstraintRef ref) {
        return graphBackend().constraintName(requireOwn(ref));
    }

    private ConstraintRef requireOwn(ConstraintRef ref) {
        Objects.requireNonNull(ref, "ref");
        if (ref.getElement() != this) {
            throw new IllegalArgumentException("constraint " + ref + " does not belong to edge " + label);
        }
        return ref;
    }

    @Override
    public String toString() {
        return label;
    }
}
