package com.eidos.collab.graph.store;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupingEngine;
import com.eidos.collab.graph.persistence.GraphPersistenceWriter;
import com.eidos.collab.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link OntologyGraphStore} per ontology, created on first access from the persisted state and
 * released again once nobody uses it and its writes are stored.
 */
public class GraphStoreRegistry {
    private static final Logger LOG = Logger.getLogger(GraphStoreRegistry.class);

    private final Map<Long, OntologyGraphStore> stores = new ConcurrentHashMap<>();
    private final GraphPersistenceWriter writer;
    private final GroupingEngine grouping;
    private final Duration lockWait;

    public GraphStoreRegistry(GraphPersistenceWriter writer, GroupingEngine grouping, Duration lockWait) {
        this.writer = writer;
        this.grouping = grouping;
        this.lockWait = lockWait;
    }

    /**
     * The store of the ontology, loading its persisted state the first time. Loading happens outside
     * the map so a slow repository does not block other ontologies; if two threads race, the first
     * registered store wins.
     */
    public OntologyGraphStore store(long ontologyId) {
        OntologyGraphStore existing = stores.get(ontologyId);
        if (existing != null && !existing.isClosed()) {
            return existing;
        }
        GraphSnapshot initial;
        try {
            initial = writer.getRepository().load(ontologyId).orElseGet(() -> GraphSnapshot.empty(ontologyId));
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logError(LOG, e, "Failed to load ontology %d", ontologyId);
            throw new GraphSyncException(ReasonCode.BUSY, ontologyId,
                    "State of ontology " + ontologyId + " could not be loaded", e);
        }
        OntologyGraphStore created = new OntologyGraphStore(initial, lockWait, grouping, writer::submit);
        OntologyGraphStore registered = stores.merge(ontologyId, created,
                (previous, fresh) -> previous.isClosed() ? fresh : previous);
        if (registered != created) {
            return registered;
        }
        LOG.infof("Opened ontology %d at revision %d", ontologyId, initial.revision());
        return created;
    }

    /**
     * Drops the store of the ontology once every write submitted for it has been handled. The store
     * is kept when a write failed and the stored state is behind, or when it was written to while the
     * release was pending.
     *
     * @return completes with whether the store was released
     */
    public CompletableFuture<Boolean> release(long ontologyId) {
        OntologyGraphStore store = stores.get(ontologyId);
        if (store == null || store.isClosed()) {
            return CompletableFuture.completedFuture(false);
        }
        long revision;
        try {
            revision = store.exclusive(GraphSnapshot::revision);
        } catch (GraphSyncException e) {
            return CompletableFuture.failedFuture(e);
        }
        return writer.flush(ontologyId).thenApply(ignored -> {
            if (writer.isOutOfSync(ontologyId)) {
                LOG.warnf("Ontology %d kept open at revision %d, its stored state is behind", ontologyId, revision);
                return false;
            }
            if (!store.close(revision)) {
                LOG.debugf("Ontology %d was written to while being released, kept open", ontologyId);
                return false;
            }
            stores.remove(ontologyId, store);
            LOG.infof("Released ontology %d at revision %d", ontologyId, revision);
            return true;
        });
    }

    public Optional<OntologyGraphStore> find(long ontologyId) {
        return Optional.ofNullable(stores.get(ontologyId));
    }

    public Set<Long> openOntologies() {
        return Set.copyOf(stores.keySet());
    }

    public GroupingEngine getGrouping() {
        return grouping;
    }
}
