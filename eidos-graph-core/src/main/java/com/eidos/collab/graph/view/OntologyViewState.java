package com.eidos.collab.graph.view;

import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupChange;
import com.eidos.collab.graph.hub.event.ConceptChanged;
import com.eidos.collab.graph.hub.event.GroupChanged;
import com.eidos.collab.graph.hub.event.HubEvent;
import com.eidos.collab.graph.hub.event.IndividualChanged;
import com.eidos.collab.graph.hub.event.IndividualRelationshipChanged;
import com.eidos.collab.graph.hub.event.MutationEvent;
import com.eidos.collab.graph.hub.event.PresenceList;
import com.eidos.collab.graph.hub.event.RelationshipChanged;
import com.eidos.collab.graph.hub.event.ResyncRequired;
import com.eidos.collab.graph.hub.event.UserJoined;
import com.eidos.collab.graph.hub.event.UserLeft;
import com.eidos.collab.graph.hub.event.UserViewChanged;
import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.presence.PresenceInfo;
import com.eidos.collab.graph.store.ConceptChange;
import com.eidos.collab.graph.store.GraphDelta;
import com.eidos.collab.graph.store.GraphSnapshot;
import com.eidos.collab.graph.store.RelationshipChange;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.ToLongFunction;

/**
 * Graph and presence state as one client session sees it.
 * <p>
 * The committed part changes only by applying a snapshot or a committed event, in revision order.
 * Mutations the client proposes are kept as pending until the committed echo (or the synchronous
 * result) with the same {@code clientRequestId} arrives; temporary ids of created entities are then
 * mapped to the ids the server assigned. A revision gap or a {@link ResyncRequired} marks the state
 * as needing a fresh snapshot.
 * </p>
 * Confined to the session that owns it; not thread-safe.
 */
public class OntologyViewState {
    private static final Logger LOG = Logger.getLogger(OntologyViewState.class);

    private final long ontologyId;
    private final SortedMap<Long, Concept> concepts = new TreeMap<>();
    private final SortedMap<Long, Relationship> relationships = new TreeMap<>();
    private final SortedMap<Long, Individual> individuals = new TreeMap<>();
    private final SortedMap<Long, IndividualRelationship> individualRelationships = new TreeMap<>();
    private final SortedMap<Long, ConceptGroup> groups = new TreeMap<>();
    private final Map<String, PresenceInfo> presence = new LinkedHashMap<>();
    private final Map<String, PendingMutation> pending = new LinkedHashMap<>();
    private final Map<Long, Long> resolvedIds = new HashMap<>();
    private final List<ViewStateListener> listeners = new CopyOnWriteArrayList<>();
    private long revision = -1;
    private long nextTemporaryId = -1;
    private boolean resyncRequired;

    public OntologyViewState(long ontologyId) {
        this.ontologyId = ontologyId;
    }

    public void addListener(ViewStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ViewStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * Replaces the committed state. Pending mutations are kept; their echoes carry later revisions.
     */
    public void applySnapshot(GraphSnapshot snapshot) {
        if (snapshot.ontologyId() != ontologyId) {
            throw new IllegalArgumentException("Snapshot of ontology " + snapshot.ontologyId()
                    + " applied to view of ontology " + ontologyId);
        }
        replace(concepts, snapshot.concepts(), Concept::id);
        replace(relationships, snapshot.relationships(), Relationship::id);
        replace(individuals, snapshot.individuals(), Individual::id);
        replace(individualRelationships, snapshot.individualRelationships(), IndividualRelationship::id);
        replace(groups, snapshot.groups(), ConceptGroup::id);
        revision = snapshot.revision();
        resyncRequired = false;
        notifyListeners(null);
    }

    /**
     * Applies an event pushed by the hub, or the committed result of this client's own proposal.
     */
    public void applyEvent(HubEvent event) {
        if (event.ontologyId() != ontologyId) {
            LOG.debugf("Ignoring %s for ontology %d in view of ontology %d",
                    event.getClass().getSimpleName(), event.ontologyId(), ontologyId);
            return;
        }
        if (event instanceof MutationEvent) {
            applyMutation((MutationEvent) event);
        } else if (event instanceof PresenceList) {
            presence.clear();
            for (PresenceInfo user : ((PresenceList) event).users()) {
                presence.put(user.connectionId(), user);
            }
        } else if (event instanceof UserJoined) {
            PresenceInfo user = ((UserJoined) event).user();
            presence.put(user.connectionId(), user);
        } else if (event instanceof UserLeft) {
            presence.remove(((UserLeft) event).connectionId());
        } else if (event instanceof UserViewChanged) {
            UserViewChanged changed = (UserViewChanged) event;
            presence.computeIfPresent(changed.connectionId(),
                    (id, user) -> user.withCurrentView(changed.viewName(), user.lastSeenAt()));
        } else if (event instanceof ResyncRequired) {
            LOG.infof("Server dropped %d events for view of ontology %d, resync required",
                    ((ResyncRequired) event).droppedEvents(), ontologyId);
            resyncRequired = true;
        }
        notifyListeners(event);
    }

    private void applyMutation(MutationEvent event) {
        reconcile(event);
        if (revision < 0 || event.revision() > revision + 1) {
            LOG.infof("Revision gap in view of ontology %d: at %d, received %d", ontologyId, revision,
                    event.revision());
            resyncRequired = true;
            return;
        }
        if (event.revision() <= revision) {
            return;
        }
        GraphDelta delta = event.delta();
        merge(concepts, delta.concepts(), delta.deletedConceptIds(), Concept::id);
        merge(relationships, delta.relationships(), delta.deletedRelationshipIds(), Relationship::id);
        merge(individuals, delta.individuals(), delta.deletedIndividualIds(), Individual::id);
        merge(individualRelationships, delta.individualRelationships(), delta.deletedIndividualRelationshipIds(),
                IndividualRelationship::id);
        merge(groups, delta.groups(), delta.deletedGroupIds(), ConceptGroup::id);
        revision = event.revision();
    }

    private void reconcile(MutationEvent event) {
        if (event.clientRequestId() == null) {
            return;
        }
        PendingMutation confirmed = pending.remove(event.clientRequestId());
        if (confirmed == null || confirmed.temporaryId() == null || event.changeType() != ChangeType.ADDED) {
            return;
        }
        Long serverId = committedId(event);
        if (serverId != null) {
            long temporaryId = confirmed.temporaryId();
            long resolvedId = serverId;
            resolvedIds.put(temporaryId, resolvedId);
            LOG.debugf("Temporary id %d resolved to %d in ontology %d", temporaryId, resolvedId, ontologyId);
        }
    }

    private static Long committedId(MutationEvent event) {
        if (event instanceof ConceptChanged) {
            return ((ConceptChanged) event).concept().id();
        } else if (event instanceof RelationshipChanged) {
            return ((RelationshipChanged) event).relationship().id();
        } else if (event instanceof IndividualChanged) {
            return ((IndividualChanged) event).individual().id();
        } else if (event instanceof IndividualRelationshipChanged) {
            return ((IndividualRelationshipChanged) event).individualRelationship().id();
        } else if (event instanceof GroupChanged) {
            return ((GroupChanged) event).group().id();
        }
        return null;
    }

    /**
     * Registers a concept change about to be sent. A create without an id gets a negative temporary id
     * that {@link #resolveId(long)} maps to the server id once confirmed.
     *
     * @return the change to send, carrying its client request id
     */
    public ConceptChange proposeConceptChange(ConceptChange change) {
        String requestId = requestIdOf(change.clientRequestId());
        ConceptChange tagged = change.withClientRequestId(requestId);
        Long temporaryId = change.changeType() == ChangeType.ADDED && change.conceptId() == null
                ? nextTemporaryId-- : null;
        track(new PendingMutation(requestId, tagged, temporaryId, revision));
        return tagged;
    }

    public RelationshipChange proposeRelationshipChange(RelationshipChange change) {
        String requestId = requestIdOf(change.clientRequestId());
        RelationshipChange tagged = change.withClientRequestId(requestId);
        Long temporaryId = change.changeType() == ChangeType.ADDED && change.relationshipId() == null
                ? nextTemporaryId-- : null;
        track(new PendingMutation(requestId, tagged, temporaryId, revision));
        return tagged;
    }

    public GroupChange proposeGroupChange(GroupChange change) {
        String requestId = requestIdOf(change.clientRequestId());
        GroupChange tagged = change.withClientRequestId(requestId);
        track(new PendingMutation(requestId, tagged, null, revision));
        return tagged;
    }

    /**
     * Drops a pending mutation the server rejected. A stale-state rejection also marks the view for
     * resynchronization.
     */
    public void reject(String clientRequestId, ReasonCode reason) {
        PendingMutation dropped = pending.remove(clientRequestId);
        if (dropped == null) {
            return;
        }
        LOG.debugf("Pending mutation %s rejected: %s", clientRequestId, reason);
        if (reason == ReasonCode.STALE_STATE) {
            resyncRequired = true;
        }
        notifyListeners(null);
    }

    /**
     * The server id a temporary id was replaced with, once the creation was confirmed.
     */
    public Optional<Long> resolveId(long temporaryId) {
        return Optional.ofNullable(resolvedIds.get(temporaryId));
    }

    /**
     * Committed concepts with the pending concept changes applied on top.
     */
    public Map<Long, Concept> conceptsWithPending() {
        Map<Long, Concept> view = new TreeMap<>(concepts);
        for (PendingMutation mutation : pending.values()) {
            if (!(mutation.change() instanceof ConceptChange)) {
                continue;
            }
            ConceptChange change = (ConceptChange) mutation.change();
            switch (change.changeType()) {
                case ADDED: {
                    long id = change.conceptId() != null ? change.conceptId() : mutation.temporaryId();
                    view.put(id, new Concept(id, ontologyId, change.name() != null ? change.name() : "",
                            change.category(), change.color(), change.definition(), change.position(), 0L));
                    break;
                }
                case UPDATED: {
                    Concept current = change.conceptId() != null ? view.get(change.conceptId()) : null;
                    if (current != null) {
                        view.put(current.id(), new Concept(current.id(), ontologyId,
                                change.name() != null ? change.name() : current.name(),
                                change.category() != null ? change.category() : current.category(),
                                change.color() != null ? change.color() : current.color(),
                                change.definition() != null ? change.definition() : current.definition(),
                                change.position() != null ? change.position() : current.position(),
                                current.version()));
                    }
                    break;
                }
                case DELETED:
                    if (change.conceptId() != null) {
                        view.remove(change.conceptId());
                    }
                    break;
                default:
                    break;
            }
        }
        return Collections.unmodifiableMap(view);
    }

    public long getOntologyId() {
        return ontologyId;
    }

    /**
     * Last applied revision, -1 before the first snapshot.
     */
    public long getRevision() {
        return revision;
    }

    public boolean isResyncRequired() {
        return resyncRequired;
    }

    public Map<Long, Concept> getConcepts() {
        return Collections.unmodifiableMap(concepts);
    }

    public Map<Long, Relationship> getRelationships() {
        return Collections.unmodifiableMap(relationships);
    }

    public Map<Long, Individual> getIndividuals() {
        return Collections.unmodifiableMap(individuals);
    }

    public Map<Long, IndividualRelationship> getIndividualRelationships() {
        return Collections.unmodifiableMap(individualRelationships);
    }

    public Map<Long, ConceptGroup> getGroups() {
        return Collections.unmodifiableMap(groups);
    }

    public List<PresenceInfo> getPresence() {
        return new ArrayList<>(presence.values());
    }

    public Collection<PendingMutation> getPending() {
        return Collections.unmodifiableCollection(new ArrayList<>(pending.values()));
    }

    private void track(PendingMutation mutation) {
        pending.put(mutation.clientRequestId(), mutation);
        notifyListeners(null);
    }

    private static String requestIdOf(String proposed) {
        return proposed != null ? proposed : UUID.randomUUID().toString();
    }

    private void notifyListeners(HubEvent cause) {
        for (ViewStateListener listener : listeners) {
            listener.onChange(this, cause);
        }
    }

    private static <T> void replace(Map<Long, T> target, Collection<T> entities, ToLongFunction<T> id) {
        target.clear();
        for (T entity : entities) {
            target.put(id.applyAsLong(entity), entity);
        }
    }

    private static <T> void merge(Map<Long, T> target, Collection<T> upserts, Collection<Long> deletes,
                                  ToLongFunction<T> id) {
        deletes.forEach(target::remove);
        for (T entity : upserts) {
            target.put(id.applyAsLong(entity), entity);
        }
    }
}
