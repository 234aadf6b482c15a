package org.optigraph.backend;

import org.optigraph.core.OptiGraphException;

/**
 * Thrown when a variable handle cannot be resolved to a home element or to a slot in
 * a backend's local index space.
 */
public final class MissingVariableException extends OptiGraphException {
    public static final String REASON_MISSING_VARIABLE = "OG_MISSING_VARIABLE";

    public MissingVariableException(String message) {
        super(REASON_MISSING_VARIABLE, message);
    }
}
