package org.optigraph.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Scope owning local variables.
 * <p>
 * A new variable is registered right away in the backend of every graph containing the node.
 * Linking constraints on edges pull node variables into further backends on demand.
 */
public final class OptiNode implements OptiElement {

    @Getter
    @Accessors(fluent = true)
    private final OptiGraph sourceGraph;
    @Getter
    @Accessors(fluent = true)
    private final String label;

    private final List<String> variableNames = new ArrayList<>();

    OptiNode(OptiGraph sourceGraph, String label) {
        this.sourceGraph = Objects.requireNonNull(sourceGraph, "sourceGraph");
        this.label = Objects.requireNonNull(label, "label");
    }

    /**
     * Creates a variable on this node.
     *
     * @param name variable name, unique on this node.
     * @return the new handle.
     */
    public NodeVariableRef addVariable(String name) {
        String normalized = Objects.requireNonNull(name, "name").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("variable name must be non-blank");
        }
        if (variableNames.contains(normalized)) {
            throw new IllegalArgumentException("variable " + normalized + " already exists on node " + label);
        }
        variableNames.add(normalized);
        NodeVariableRef ref = new NodeVariableRef(this, variableNames.size());
        for (OptiGraph graph : containingGraphs()) {
            graph.graphBackend().addVariable(ref);
        }
        return ref;
    }

    /**
     * Returns the handle of the variable named {@code name}.
     *
     * @throws UnknownObjectException when no such variable exists.
     */
    public NodeVariableRef variable(String name) {
        int position = variableNames.indexOf(Objects.requireNonNull(name, "name").trim());
        if (position < 0) {
            throw new UnknownObjectException(label, name);
        }
        return new NodeVariableRef(this, position + 1);
    }

    public List<NodeVariableRef> variables() {
        List<NodeVariableRef> refs = new ArrayList<>(variableNames.size());
        for (int i = 1; i <= variableNames.size(); i++) {
            refs.add(new NodeVariableRef(this, i));
        }
        return Collections.unmodifiableList(refs);
    }

    public int numVariables() {
        return variableNames.size();
    }

    /**
     * Returns true when {@code variable} is a handle created by this node.
     */
    public boolean ownsVariable(NodeVariableRef variable) {
        return variable != null
                && variable.getNode() == this
                && variable.getIndex() <= variableNames.size();
    }

    String variableName(int index) {
        return variableNames.get(index - 1);
    }

    /**
     * Nodes are stored by the backend of their optimizer graph only.
     */
    @Override
    public List<OptiGraph> containingGraphs() {
        return List.of(optimizerGraph());
    }

    @Override
    public String toString() {
        return label;
    }
}
