package com.eidos.collab.graph.exceptions;

import java.util.Objects;

/**
 * Thrown when a proposed mutation or subscription is rejected.
 * <p>
 * A rejection never leaves a partial mutation behind and is never broadcast; it is returned
 * synchronously to the requesting client with its {@link ReasonCode}.
 * </p>
 */
public class GraphSyncException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ReasonCode reason;
    private final Long ontologyId;

    public GraphSyncException(ReasonCode reason, String message) {
        this(reason, null, message, null);
    }

    public GraphSyncException(ReasonCode reason, Long ontologyId, String message) {
        this(reason, ontologyId, message, null);
    }

    public GraphSyncException(ReasonCode reason, Long ontologyId, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.ontologyId = ontologyId;
    }

    public static GraphSyncException notFound(long ontologyId, String kind, long id) {
        return new GraphSyncException(ReasonCode.NOT_FOUND, ontologyId,
                String.format("%s %d not found in ontology %d", kind, id, ontologyId));
    }

    public static GraphSyncException invalidReference(long ontologyId, String message) {
        return new GraphSyncException(ReasonCode.INVALID_REFERENCE, ontologyId, message);
    }

    public static GraphSyncException invalidRequest(long ontologyId, String message) {
        return new GraphSyncException(ReasonCode.INVALID_REQUEST, ontologyId, message);
    }

    public static GraphSyncException conflict(long ontologyId, String message) {
        return new GraphSyncException(ReasonCode.CONFLICT, ontologyId, message);
    }

    public static GraphSyncException stale(long ontologyId, String kind, long id, long expected, long actual) {
        return new GraphSyncException(ReasonCode.STALE_STATE, ontologyId,
                String.format("%s %d is at version %d, client assumed %d", kind, id, actual, expected));
    }

    public static GraphSyncException permissionDenied(long ontologyId, String message) {
        return new GraphSyncException(ReasonCode.PERMISSION_DENIED, ontologyId, message);
    }

    /**
     * The reason code clients switch on.
     */
    public ReasonCode getReason() {
        return reason;
    }

    /**
     * The ontology the rejected request targeted, when known.
     */
    public Long getOntologyId() {
        return ontologyId;
    }

    public boolean isRetryable() {
        return reason.isRetryable();
    }
}
