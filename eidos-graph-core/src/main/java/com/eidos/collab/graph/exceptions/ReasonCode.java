package com.eidos.collab.graph.exceptions;

/**
 * Reason attached to a rejected mutation. Clients switch on this code, never on the message.
 */
public enum ReasonCode {
    PERMISSION_DENIED(false),
    /** Malformed payload: a required field is missing or blank. */
    INVALID_REQUEST(false),
    NOT_FOUND(false),
    INVALID_REFERENCE(false),
    ALREADY_GROUPED(false),
    CIRCULAR_REFERENCE(false),
    DEPTH_EXCEEDED(false),
    /** The client's assumed version conflicts with the current one; refetch and retry. */
    STALE_STATE(true),
    /** Duplicate id or a delete blocked by dependent entities. */
    CONFLICT(false),
    /** The ontology's write lock could not be acquired within the configured wait. */
    BUSY(true);

    private final boolean retryable;

    ReasonCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
