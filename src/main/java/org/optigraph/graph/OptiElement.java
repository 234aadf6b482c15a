package org.optigraph.graph;

import org.optigraph.backend.GraphBackend;

import java.util.List;

/**
 * An element of an {@link OptiGraph} that can own constraints: a node or an edge.
 * <p>
 * Elements compare by identity.
 */
public interface OptiElement {

    /**
     * Label unique among sibling elements of the same kind in the source graph.
     */
    String label();

    /**
     * Graph that created this element and holds its object data.
     */
    OptiGraph sourceGraph();

    /**
     * Graph whose backend stores this element's model data. Usually the source graph,
     * or an ancestor when sub-graph data is flattened into a parent backend.
     */
    default OptiGraph optimizerGraph() {
        return sourceGraph().optimizerGraph();
    }

    /**
     * Primary backend of this element: the backend of {@link #optimizerGraph()}.
     */
    default GraphBackend graphBackend() {
        return optimizerGraph().graphBackend();
    }

    /**
     * Graphs whose backends hold this element's constraints, primary first. Never empty.
     */
    List<OptiGraph> containingGraphs();
}
