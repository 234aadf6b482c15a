package org.optigraph.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.backend.GraphBackend;
import org.optigraph.backend.InMemoryModelStore;
import org.optigraph.backend.ModelStore;
import org.optigraph.registration.EdgeConstraintRegistrar;
import org.optigraph.registration.RegistrationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Container of nodes, edges and nested sub-graphs.
 * <p>
 * Every graph has one optimizer graph whose backend stores its data: itself when it owns a
 * backend, or the optimizer graph of its parent when it was added with
 * {@link #addFlattenedSubgraph(String)}. Edges may additionally be mirrored into enclosing
 * graphs with {@link #mirrorEdge(OptiEdge, OptiGraph)}.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 */
public final class OptiGraph {
    private static final Logger LOG = LoggerFactory.getLogger(OptiGraph.class);

    @Getter
    @Accessors(fluent = true)
    private final String label;
    @Getter
    @Accessors(fluent = true)
    private final OptiGraph parent;
    @Getter
    @Accessors(fluent = true)
    private final OptiGraph optimizerGraph;
    @Getter
    @Accessors(fluent = true)
    private final RegistrationConfig registrationConfig;

    private final GraphBackend backend;
    private final EdgeConstraintRegistrar registrar;

    private final Map<String, OptiNode> nodes = new LinkedHashMap<>();
    private final Map<String, OptiEdge> edges = new LinkedHashMap<>();
    private final Map<String, OptiGraph> subgraphs = new LinkedHashMap<>();
    private final Map<OptiEdge, List<OptiGraph>> edgeToGraphs = new IdentityHashMap<>();

    /**
     * Creates a root graph over an in-memory store accepting every constraint shape.
     */
    public OptiGraph(String label) {
        this(label, new InMemoryModelStore(), RegistrationConfig.defaultConfig());
    }

    /**
     * Creates a root graph over {@code store}.
     *
     * @param label graph label.
     * @param store solver-side store for this graph's backend.
     * @param registrationConfig registration behavior inherited by every sub-graph.
     */
    public OptiGraph(String label, ModelStore store, RegistrationConfig registrationConfig) {
        this.label = requireLabel(label);
        this.parent = null;
        this.optimizerGraph = this;
        this.registrationConfig = Objects.requireNonNull(registrationConfig, "registrationConfig");
        this.backend = new GraphBackend(this, Objects.requireNonNull(store, "store"));
        this.registrar = new EdgeConstraintRegistrar(registrationConfig);
    }

    private OptiGraph(String label, OptiGraph parent, ModelStore storeOrNull) {
        this.label = requireLabel(label);
        this.parent = parent;
        this.registrationConfig = parent.registrationConfig;
        this.registrar = parent.registrar;
        if (storeOrNull == null) {
            this.optimizerGraph = parent.optimizerGraph;
            this.backend = null;
        } else {
            this.optimizerGraph = this;
            this.backend = new GraphBackend(this, storeOrNull);
        }
    }

    // ========================================================================
    // STRUCTURE
    // ========================================================================

    /**
     * Adds a sub-graph with its own in-memory backend.
     */
    public OptiGraph addSubgraph(String label) {
        return addSubgraph(label, new InMemoryModelStore());
    }

    /**
     * Adds a sub-graph with its own backend over {@code store}.
     */
    public OptiGraph addSubgraph(String label, ModelStore store) {
        return registerSubgraph(new OptiGraph(label, this, Objects.requireNonNull(store, "store")));
    }

    /**
     * Adds a sub-graph whose data is stored in this graph's optimizer backend.
     */
    public OptiGraph addFlattenedSubgraph(String label) {
        return registerSubgraph(new OptiGraph(label, this, null));
    }

    private OptiGraph registerSubgraph(OptiGraph subgraph) {
        if (subgraphs.containsKey(subgraph.label)) {
            throw new IllegalArgumentException("subgraph " + subgraph.label + " already exists in graph " + label);
        }
        subgraphs.put(subgraph.label, subgraph);
        LOG.debug("graph {}: added subgraph {} (optimizer graph {})", label, subgraph.label, subgraph.optimizerGraph.label);
        return subgraph;
    }

    /**
     * Adds a node to this graph.
     *
     * @param label node label, unique among this graph's nodes.
     */
    public OptiNode addNode(String label) {
        String normalized = requireLabel(label);
        if (nodes.containsKey(normalized)) {
            throw new IllegalArgumentException("node " + normalized + " already exists in graph " + this.label);
        }
        OptiNode node = new OptiNode(this, normalized);
        nodes.put(normalized, node);
        return node;
    }

    /**
     * Adds an edge coupling {@code nodes}.
     *
     * @see #addEdge(String, Collection)
     */
    public OptiEdge addEdge(String label, OptiNode... nodes) {
        return addEdge(label, Arrays.asList(nodes));
    }

    /**
     * Adds an edge coupling {@code nodes}. Duplicate nodes are collapsed.
     *
     * @param label edge label, unique among this graph's edges.
     * @param nodes coupled nodes; each must belong to this graph or one of its sub-graphs.
     * @return the new edge.
     */
    public OptiEdge addEdge(String label, Collection<OptiNode> nodes) {
        String normalized = requireLabel(label);
        if (edges.containsKey(normalized)) {
            throw new IllegalArgumentException("edge " + normalized + " already exists in graph " + this.label);
        }
        Objects.requireNonNull(nodes, "nodes");
        LinkedHashSet<OptiNode> unique = new LinkedHashSet<>();
        for (OptiNode node : nodes) {
            Objects.requireNonNull(node, "node");
            if (!containsNode(node)) {
                throw new IllegalArgumentException("node " + node.label() + " is not part of graph " + this.label);
            }
            unique.add(node);
        }
        OptiEdge edge = new OptiEdge(this, normalized, unique);
        edges.put(normalized, edge);
        return edge;
    }

    /**
     * Records that the backend of {@code graph} also stores the constraints of {@code edge}.
     *
     * @param edge edge created by this graph; must not have constraints yet.
     * @param graph this graph or an ancestor of it, whose backend is not yet containing the edge.
     */
    public void mirrorEdge(OptiEdge edge, OptiGraph graph) {
        Objects.requireNonNull(edge, "edge");
        Objects.requireNonNull(graph, "graph");
        if (edge.sourceGraph() != this) {
            throw new IllegalArgumentException("edge " + edge.label() + " was not created by graph " + label);
        }
        if (!graph.isSelfOrAncestorOf(this)) {
            throw new IllegalArgumentException("graph " + graph.label + " does not enclose graph " + label);
        }
        for (OptiGraph containing : edge.containingGraphs()) {
            if (containing.graphBackend() == graph.graphBackend()) {
                throw new IllegalArgumentException(
                        "backend of graph " + graph.label + " already contains edge " + edge.label());
            }
        }
        if (!edge.allConstraints().isEmpty()) {
            throw new IllegalStateException("edge " + edge.label() + " already has constraints; mirror it before adding any");
        }
        edgeToGraphs.computeIfAbsent(edge, e -> new ArrayList<>()).add(graph);
        LOG.debug("graph {}: edge {} mirrored into graph {}", label, edge.label(), graph.label);
    }

    /**
     * Additional graphs mirroring {@code edge}, in registration order.
     */
    public List<OptiGraph> mirrorGraphs(OptiEdge edge) {
        List<OptiGraph> graphs = edgeToGraphs.get(edge);
        return graphs == null ? Collections.emptyList() : Collections.unmodifiableList(graphs);
    }

    // ========================================================================
    // LOOKUP
    // ========================================================================

    /**
     * Backend storing this graph's data (the backend of {@link #optimizerGraph()}).
     */
    public GraphBackend graphBackend() {
        return optimizerGraph.backend;
    }

    public boolean hasOwnBackend() {
        return backend != null;
    }

    public OptiNode node(String label) {
        OptiNode node = nodes.get(requireLabel(label));
        if (node == null) {
            throw new IllegalArgumentException("no node " + label + " in graph " + this.label);
        }
        return node;
    }

    public OptiEdge edge(String label) {
        OptiEdge edge = edges.get(requireLabel(label));
        if (edge == null) {
            throw new IllegalArgumentException("no edge " + label + " in graph " + this.label);
        }
        return edge;
    }

    public OptiGraph subgraph(String label) {
        OptiGraph subgraph = subgraphs.get(requireLabel(label));
        if (subgraph == null) {
            throw new IllegalArgumentException("no subgraph " + label + " in graph " + this.label);
        }
        return subgraph;
    }

    /**
     * Nodes created directly on this graph.
     */
    public List<OptiNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /**
     * Edges created directly on this graph.
     */
    public List<OptiEdge> edges() {
        return List.copyOf(edges.values());
    }

    public List<OptiGraph> subgraphs() {
        return List.copyOf(subgraphs.values());
    }

    /**
     * Nodes of this graph and of every nested sub-graph.
     */
    public List<OptiNode> allNodes() {
        List<OptiNode> all = new ArrayList<>(nodes.values());
        for (OptiGraph subgraph : subgraphs.values()) {
            all.addAll(subgraph.allNodes());
        }
        return all;
    }

    /**
     * Returns true when {@code node} belongs to this graph or a nested sub-graph.
     */
    public boolean containsNode(OptiNode node) {
        return node != null && isSelfOrAncestorOf(node.sourceGraph());
    }

    private boolean isSelfOrAncestorOf(OptiGraph graph) {
        for (OptiGraph current = graph; current != null; current = current.parent) {
            if (current == this) {
                return true;
            }
        }
        return false;
    }

    EdgeConstraintRegistrar registrar() {
        return registrar;
    }

    private static String requireLabel(String label) {
        String normalized = Objects.requireNonNull(label, "label").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("label must be non-blank");
        }
        return normalized;
    }

    @Override
    public String toString() {
        return label;
    }
}
