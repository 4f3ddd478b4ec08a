package com.eidos.collab.graph.persistence;

import com.eidos.collab.graph.store.GraphDelta;
import com.eidos.collab.graph.store.GraphSnapshot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest snapshot per ontology in memory. Used when no database is configured and in tests.
 */
public class InMemoryGraphStateRepository implements GraphStateRepository {

    private final Map<Long, GraphSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<GraphSnapshot> load(long ontologyId) {
        return Optional.ofNullable(snapshots.get(ontologyId));
    }

    @Override
    public void apply(GraphDelta delta) {
        snapshots.compute(delta.ontologyId(), (id, stored) ->
                (stored != null ? stored : GraphSnapshot.empty(id)).withDelta(delta));
    }

    @Override
    public void replace(GraphSnapshot snapshot) {
        snapshots.put(snapshot.ontologyId(), snapshot);
    }
}
