package com.eidos.collab.graph.view;

/**
 * A mutation sent to the server and not yet confirmed.
 *
 * @param clientRequestId id the committed event will echo
 * @param change the proposed change payload
 * @param temporaryId local id of an entity being created, null otherwise
 * @param baseRevision revision the client was at when it proposed the change
 */
public record PendingMutation(String clientRequestId, Object change, Long temporaryId, long baseRevision) {
}
