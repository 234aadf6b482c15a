package org.optigraph.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base failure of the edge/constraint core with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code so callers can match failures
 * without parsing free text.</p>
 */
@Getter
@Accessors(fluent = true)
public class OptiGraphException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public OptiGraphException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public OptiGraphException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
