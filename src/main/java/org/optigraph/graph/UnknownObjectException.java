package org.optigraph.graph;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.optigraph.core.OptiGraphException;

/**
 * Thrown when an object-dictionary lookup names an entry that was never set.
 */
@Getter
@Accessors(fluent = true)
public final class UnknownObjectException extends OptiGraphException {
    public static final String REASON_UNKNOWN_OBJECT = "OG_UNKNOWN_OBJECT";

    private final String objectName;

    public UnknownObjectException(String elementLabel, String objectName) {
        super(REASON_UNKNOWN_OBJECT, "no object named '" + objectName + "' on " + elementLabel);
        this.objectName = objectName;
    }
}
