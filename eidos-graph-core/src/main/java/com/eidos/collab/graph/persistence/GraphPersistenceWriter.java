package com.eidos.collab.graph.persistence;

import com.eidos.collab.graph.store.GraphDelta;
import com.eidos.collab.graph.store.GraphSnapshot;
import com.eidos.collab.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Write-behind persistence of committed deltas.
 * <p>
 * Deltas of one ontology are chained so they reach the repository in commit order; different
 * ontologies are written independently. Writes run on the given executor, never on the committing
 * thread. A failed write is logged and counted and the chain continues; the ontology is then
 * marked out of sync, and its next write stores the full state instead of a delta, so the deltas
 * lost in between cannot leave the stored graph inconsistent.
 * </p>
 */
public class GraphPersistenceWriter {
    private static final Logger LOG = Logger.getLogger(GraphPersistenceWriter.class);

    private final GraphStateRepository repository;
    private final Executor executor;
    private final Map<Long, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final Set<Long> outOfSync = ConcurrentHashMap.newKeySet();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong written = new AtomicLong();

    public GraphPersistenceWriter(GraphStateRepository repository, Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    public GraphStateRepository getRepository() {
        return repository;
    }

    /**
     * Queues one commit.
     *
     * @param delta what the commit changed
     * @param state the state right after the commit, written in full when earlier writes failed
     */
    public void submit(GraphDelta delta, GraphSnapshot state) {
        if (delta.isEmpty()) {
            return;
        }
        tails.compute(delta.ontologyId(), (id, tail) ->
                (tail != null ? tail : CompletableFuture.<Void>completedFuture(null))
                        .thenRunAsync(() -> write(delta, state), executor));
    }

    /**
     * Completes once every delta submitted so far for the ontology has been handled.
     */
    public CompletableFuture<Void> flush(long ontologyId) {
        CompletableFuture<Void> tail = tails.get(ontologyId);
        return tail != null ? tail : CompletableFuture.completedFuture(null);
    }

    public CompletableFuture<Void> flushAll() {
        return CompletableFuture.allOf(tails.values().toArray(new CompletableFuture[0]));
    }

    public long getFailureCount() {
        return failures.get();
    }

    public long getWrittenCount() {
        return written.get();
    }

    /**
     * Whether a write of the ontology failed and the stored state has not been rewritten since.
     */
    public boolean isOutOfSync(long ontologyId) {
        return outOfSync.contains(ontologyId);
    }

    private void write(GraphDelta delta, GraphSnapshot state) {
        long ontologyId = delta.ontologyId();
        try {
            if (outOfSync.contains(ontologyId)) {
                repository.replace(state);
                outOfSync.remove(ontologyId);
                LOG.infof("Rewrote ontology %d in full at revision %d after a failed write", ontologyId,
                        state.revision());
            } else {
                repository.apply(delta);
            }
            written.incrementAndGet();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            outOfSync.add(ontologyId);
            ExceptionLoggingUtils.logError(LOG, e,
                    "Failed to persist revision %d of ontology %d; its next write stores the full state",
                    delta.revision(), ontologyId);
        }
    }
}
