package io.paradedb.operator.core;

import org.jspecify.annotations.NullMarked;

@NullMarked
public class ParadeDBException extends RuntimeException {
    public ParadeDBException(String message) {
        super(message);
    }

    public ParadeDBException(String message, Throwable cause) {
        super(message, cause);
    }
}
