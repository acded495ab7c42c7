package com.healthauth.core.snapshot;

/**
 * Thrown when a snapshot cannot be encoded, decoded or restored.
 */
public class SnapshotException extends RuntimeException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
