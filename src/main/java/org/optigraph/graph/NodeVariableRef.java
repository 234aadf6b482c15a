package org.optigraph.graph;

import lombok.Value;

import java.util.Objects;

/**
 * Handle of a variable owned by an {@link OptiNode}. Indices start at {@code 1} per node.
 */
@Value
public class NodeVariableRef {
    OptiNode node;
    int index;

    public NodeVariableRef(OptiNode node, int index) {
        this.node = Objects.requireNonNull(node, "node");
        if (index < 1) {
            throw new IllegalArgumentException("variable index must be >= 1, got " + index);
        }
        this.index = index;
    }

    /**
     * Variable name as declared on the node, or {@code node[index]} for foreign handles.
     */
    public String name() {
        return node.ownsVariable(this) ? node.variableName(index) : node.label() + "[" + index + "]";
    }

    @Override
    public String toString() {
        return node.label() + "." + name();
    }
}
