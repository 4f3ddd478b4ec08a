package com.eidos.collab.graph.store;

/**
 * Result of a write.
 *
 * @param result value returned by the work
 * @param snapshot state published by the write, or the unchanged state when nothing changed
 * @param delta what the write changed, empty when nothing changed
 * @param changed whether a new revision was published
 */
public record GraphCommit<T>(T result, GraphSnapshot snapshot, GraphDelta delta, boolean changed) {

    public long revision() {
        return snapshot.revision();
    }

    public long ontologyId() {
        return snapshot.ontologyId();
    }
}
