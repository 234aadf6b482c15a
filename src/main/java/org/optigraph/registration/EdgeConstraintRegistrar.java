package org.optigraph.registration;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.backend.GraphBackend;
import org.optigraph.backend.MissingVariableException;
import org.optigraph.backend.UnsupportedShapeException;
import org.optigraph.backend.VariableIndex;
import org.optigraph.graph.NodeVariableRef;
import org.optigraph.graph.OptiEdge;
import org.optigraph.graph.OptiGraph;
import org.optigraph.model.constraint.CanonicalConstraint;
import org.optigraph.model.constraint.ConstraintIndex;
import org.optigraph.model.constraint.ConstraintRef;
import org.optigraph.model.constraint.ConstraintShape;
import org.optigraph.model.constraint.ScalarConstraint;
import org.optigraph.model.constraint.ValueShape;
import org.optigraph.model.expr.VariableExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Registers linking constraints on edges and mirrors them into every containing backend.
 *
 * <p>Execution flow of {@link #addConstraint(OptiEdge, ScalarConstraint, String)}:</p>
 * <ol>
 * <li>Canonicalize the constraint into a function and a set.</li>
 * <li>Allocate the graph-level index against the edge's primary backend.</li>
 * <li>For every containing graph, primary first: register variables the backend has not
 *     seen yet, remap the function into local variable slots, store it and record the
 *     reference mapping.</li>
 * </ol>
 * <p>
 * With {@link RegistrationPolicy#VALIDATE_THEN_COMMIT} every backend is checked before any is
 * written. Failures after at least one backend was written surface as
 * {@link PartialRegistrationException}; nothing is rolled back.
 * </p>
 */
public final class EdgeConstraintRegistrar {
    private static final Logger LOG = LoggerFactory.getLogger(EdgeConstraintRegistrar.class);

    @Getter
    @Accessors(fluent = true)
    private final RegistrationConfig config;

    public EdgeConstraintRegistrar(RegistrationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Adds {@code constraint} to {@code edge}.
     *
     * @param edge owning edge.
     * @param constraint constraint over node variables.
     * @param name constraint name; {@code null} is treated as empty.
     * @return graph-level reference, valid against every containing backend.
     * @throws UnsupportedShapeException when a containing backend rejects the constraint shape
     *                                   before any backend was written.
     * @throws MissingVariableException when a referenced variable has no home node.
     * @throws PartialRegistrationException when a backend fails after others were written.
     */
    public ConstraintRef addConstraint(OptiEdge edge, ScalarConstraint constraint, String name) {
        Objects.requireNonNull(edge, "edge");
        Objects.requireNonNull(constraint, "constraint");
        String constraintName = name == null ? "" : name;

        CanonicalConstraint<NodeVariableRef> canonical = ConstraintCanonicalizer.canonicalize(constraint);
        ConstraintShape shape = canonical.getShape();
        List<NodeVariableRef> variables = new ArrayList<>(VariableExtractor.uniqueVariables(canonical.getFunction()));
        List<OptiGraph> graphs = edge.containingGraphs();

        if (config.getPolicy() == RegistrationPolicy.VALIDATE_THEN_COMMIT) {
            validate(graphs, shape, variables);
        }

        ConstraintIndex index = ConstraintIndexAllocator.nextIndex(edge.graphBackend(), edge, shape);
        ConstraintRef ref = new ConstraintRef(edge, index, ValueShape.SCALAR);

        List<OptiGraph> updated = new ArrayList<>(graphs.size());
        for (OptiGraph graph : graphs) {
            try {
                storeInBackend(graph.graphBackend(), ref, canonical, variables, constraintName);
            } catch (RuntimeException e) {
                if (updated.isEmpty()) {
                    throw e;
                }
                LOG.warn("constraint {} left in {} after graph {} rejected it", ref, updated, graph.label(), e);
                throw new PartialRegistrationException(ref, updated, graph, e);
            }
            updated.add(graph);
        }
        LOG.debug("edge {}: registered {} {} in {}", edge.label(), ref, shape, updated);
        return ref;
    }

    private void validate(List<OptiGraph> graphs, ConstraintShape shape, List<NodeVariableRef> variables) {
        for (OptiGraph graph : graphs) {
            requireSupported(graph.graphBackend(), shape);
        }
        for (NodeVariableRef variable : variables) {
            requireHomeNode(variable);
        }
    }

    private void storeInBackend(
            GraphBackend backend,
            ConstraintRef ref,
            CanonicalConstraint<NodeVariableRef> canonical,
            List<NodeVariableRef> variables,
            String name
    ) {
        requireSupported(backend, canonical.getShape());
        List<NodeVariableRef> missing = new ArrayList<>();
        for (NodeVariableRef variable : variables) {
            if (!backend.hasVariable(variable)) {
                requireHomeNode(variable);
                missing.add(variable);
            }
        }
        for (NodeVariableRef variable : missing) {
            backend.addVariable(variable);
        }
        CanonicalConstraint<VariableIndex> local = backend.toLocal(canonical);
        ConstraintIndex elementIndex = ConstraintIndexAllocator.nextIndex(backend, ref.getElement(), canonical.getShape());
        backend.addElementConstraint(ref, elementIndex, local, name);
    }

    private static void requireSupported(GraphBackend backend, ConstraintShape shape) {
        if (!backend.supportsConstraint(shape)) {
            throw new UnsupportedShapeException(shape, backend.store().name() + " of graph " + backend.graph().label());
        }
    }

    private static void requireHomeNode(NodeVariableRef variable) {
        if (!variable.getNode().ownsVariable(variable)) {
            throw new MissingVariableException(
                    "variable index " + variable.getIndex() + " cannot be resolved on node " + variable.getNode().label());
        }
    }
}
