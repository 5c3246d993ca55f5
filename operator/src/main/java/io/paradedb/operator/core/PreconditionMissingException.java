package io.paradedb.operator.core;

import org.jspecify.annotations.NullMarked;

/**
 * A Kubernetes object that the desired state refers to, but which the operator does not own, is missing.
 */
@NullMarked
public class PreconditionMissingException extends ParadeDBException {
    public PreconditionMissingException(String message) {
        super(message);
    }
}
