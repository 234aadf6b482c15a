package org.optigraph.backend;

import lombok.Value;

/**
 * Backend-local variable slot. Values start at {@code 1} and are dense per store.
 */
@Value
public class VariableIndex {
    int value;

    public VariableIndex(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("variable index must be >= 1, got " + value);
        }
        this.value = value;
    }

    @Override
    public String toString() {
        return "v" + value;
    }
}
