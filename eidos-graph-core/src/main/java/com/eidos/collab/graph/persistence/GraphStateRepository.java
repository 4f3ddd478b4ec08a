package com.eidos.collab.graph.persistence;

import com.eidos.collab.graph.store.GraphDelta;
import com.eidos.collab.graph.store.GraphSnapshot;

import java.util.Optional;

/**
 * Durable home of ontology graphs. The in-memory store stays authoritative while the process
 * runs; the repository only has to be able to rebuild it after a restart.
 */
public interface GraphStateRepository {

    /**
     * @return the last persisted state, or empty when nothing was ever stored for the ontology
     */
    Optional<GraphSnapshot> load(long ontologyId);

    /**
     * Persists one commit. Deltas of one ontology arrive in revision order.
     */
    void apply(GraphDelta delta);

    /**
     * Stores the complete state of an ontology, discarding whatever was stored for it before.
     * Used to bring the stored state back in line after a delta could not be applied.
     */
    void replace(GraphSnapshot snapshot);
}
