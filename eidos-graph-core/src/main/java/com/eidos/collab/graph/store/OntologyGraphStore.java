package com.eidos.collab.graph.store;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupChange;
import com.eidos.collab.graph.grouping.GroupChangeResult;
import com.eidos.collab.graph.grouping.GroupingEngine;
import com.eidos.collab.graph.grouping.VisibleGraph;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Canonical graph of one ontology.
 * <p>
 * Reads return the current immutable {@link GraphSnapshot} without locking. Writes are serialized
 * by a fair lock acquired with a bounded wait; a write that cannot acquire it in time fails with
 * {@link ReasonCode#BUSY}. The work runs on a private {@link GraphTransaction}; if it throws,
 * nothing is published. Otherwise the next snapshot is published at {@code revision + 1}, the
 * commit listener receives its {@link GraphDelta} together with that snapshot, and the caller's
 * commit callback runs before the lock is released so callbacks observe commits in order.
 * </p>
 */
public class OntologyGraphStore {
    private static final Logger LOG = Logger.getLogger(OntologyGraphStore.class);

    private final long ontologyId;
    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final Duration lockWait;
    private final GroupingEngine grouping;
    private final BiConsumer<GraphDelta, GraphSnapshot> commitListener;
    private volatile GraphSnapshot current;
    private volatile boolean closed;

    public OntologyGraphStore(GraphSnapshot initial, Duration lockWait, GroupingEngine grouping,
                              BiConsumer<GraphDelta, GraphSnapshot> commitListener) {
        this.ontologyId = initial.ontologyId();
        this.current = initial;
        this.lockWait = Objects.requireNonNull(lockWait, "lockWait");
        this.grouping = Objects.requireNonNull(grouping, "grouping");
        this.commitListener = commitListener != null ? commitListener : (delta, state) -> { };
    }

    public long getOntologyId() {
        return ontologyId;
    }

    public GraphSnapshot snapshot() {
        return current;
    }

    public VisibleGraph visibleGraph() {
        return VisibleGraph.project(current);
    }

    public GroupingEngine getGrouping() {
        return grouping;
    }

    public <T> GraphCommit<T> write(GraphWork<T> work) {
        return write(work, null);
    }

    /**
     * Runs the work under the write lock and publishes its changes.
     *
     * @param work the mutation
     * @param onCommit invoked with the commit while the lock is still held, also for writes that
     *                 changed nothing; may be null
     */
    public <T> GraphCommit<T> write(GraphWork<T> work, Consumer<GraphCommit<T>> onCommit) {
        acquire();
        try {
            if (closed) {
                throw new GraphSyncException(ReasonCode.BUSY, ontologyId,
                        "Ontology " + ontologyId + " was released, retry later");
            }
            GraphSnapshot base = current;
            GraphTransaction tx = new GraphTransaction(base);
            T result = work.apply(tx);
            GraphCommit<T> commit;
            if (tx.hasChanges()) {
                long revision = base.revision() + 1;
                GraphSnapshot next = tx.toSnapshot(revision);
                GraphDelta delta = tx.toDelta(revision);
                current = next;
                LOG.debugf("Committed revision %d of ontology %d", revision, ontologyId);
                commitListener.accept(delta, next);
                commit = new GraphCommit<>(result, next, delta, true);
            } else {
                commit = new GraphCommit<>(result, base, GraphDelta.empty(ontologyId, base.revision(), base.nextId()),
                        false);
            }
            if (onCommit != null) {
                onCommit.accept(commit);
            }
            return commit;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Runs a read while holding the write lock, so no commit can interleave with it.
     */
    public <T> T exclusive(Function<GraphSnapshot, T> read) {
        acquire();
        try {
            return read.apply(current);
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops accepting writes if the store is still at the given revision. Reads keep working.
     *
     * @return false when a write committed after {@code expectedRevision}
     */
    boolean close(long expectedRevision) {
        acquire();
        try {
            if (current.revision() != expectedRevision) {
                return false;
            }
            closed = true;
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public GraphCommit<Concept> applyConceptChange(ConceptChange change) {
        return write(tx -> GraphMutations.applyConceptChange(tx, change));
    }

    public GraphCommit<Relationship> applyRelationshipChange(RelationshipChange change) {
        return write(tx -> GraphMutations.applyRelationshipChange(tx, change));
    }

    public GraphCommit<Individual> applyIndividualChange(IndividualChange change) {
        return write(tx -> GraphMutations.applyIndividualChange(tx, change));
    }

    public GraphCommit<IndividualRelationship> applyIndividualRelationshipChange(IndividualRelationshipChange change) {
        return write(tx -> GraphMutations.applyIndividualRelationshipChange(tx, change));
    }

    public GraphCommit<GroupChangeResult> applyGroupChange(String userId, GroupChange change) {
        return write(tx -> grouping.apply(tx, userId, change));
    }

    public boolean canCreateGroup(long parentConceptId, Collection<Long> candidateChildIds) {
        return grouping.canCreateGroup(current, parentConceptId, candidateChildIds);
    }

    private void acquire() {
        boolean acquired;
        try {
            acquired = writeLock.tryLock(lockWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GraphSyncException(ReasonCode.BUSY, ontologyId,
                    "Interrupted while waiting for the write lock of ontology " + ontologyId, e);
        }
        if (!acquired) {
            LOG.warnf("Write lock of ontology %d not acquired within %d ms", ontologyId, lockWait.toMillis());
            throw new GraphSyncException(ReasonCode.BUSY, ontologyId,
                    "Ontology " + ontologyId + " is busy, retry later");
        }
    }
}
