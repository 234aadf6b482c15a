package org.optigraph.registration;

/**
 * Behavior of constraint registration when one of several containing backends rejects it.
 */
public enum RegistrationPolicy {
    /**
     * Check shape support and variable resolution in every containing backend before
     * touching any of them. Known rejections leave all backends unchanged.
     */
    VALIDATE_THEN_COMMIT,
    /**
     * Update backends one after another without prior checks. Backends updated before a
     * failure keep the constraint and are reported through {@link PartialRegistrationException}.
     * Each backend still checks shape support before registering any variable, so a shape
     * rejection leaves that backend unchanged.
     */
    BEST_EFFORT
}
