package com.eidos.collab.graph.hub;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupChange;
import com.eidos.collab.graph.grouping.GroupChangeResult;
import com.eidos.collab.graph.grouping.VisibleGraph;
import com.eidos.collab.graph.hub.event.ConceptChanged;
import com.eidos.collab.graph.hub.event.GroupChanged;
import com.eidos.collab.graph.hub.event.HubEvent;
import com.eidos.collab.graph.hub.event.IndividualChanged;
import com.eidos.collab.graph.hub.event.IndividualRelationshipChanged;
import com.eidos.collab.graph.hub.event.LeaveReason;
import com.eidos.collab.graph.hub.event.MutationEvent;
import com.eidos.collab.graph.hub.event.PresenceList;
import com.eidos.collab.graph.hub.event.RelationshipChanged;
import com.eidos.collab.graph.hub.event.UserJoined;
import com.eidos.collab.graph.hub.event.UserLeft;
import com.eidos.collab.graph.hub.event.UserViewChanged;
import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.permission.Action;
import com.eidos.collab.graph.permission.AuthorizationDecision;
import com.eidos.collab.graph.permission.PermissionGate;
import com.eidos.collab.graph.presence.AvatarColors;
import com.eidos.collab.graph.presence.PresenceInfo;
import com.eidos.collab.graph.presence.SessionRegistry;
import com.eidos.collab.graph.store.ConceptChange;
import com.eidos.collab.graph.store.GraphCommit;
import com.eidos.collab.graph.store.GraphMutations;
import com.eidos.collab.graph.store.GraphSnapshot;
import com.eidos.collab.graph.store.GraphStoreRegistry;
import com.eidos.collab.graph.store.GraphWork;
import com.eidos.collab.graph.store.IndividualChange;
import com.eidos.collab.graph.store.IndividualRelationshipChange;
import com.eidos.collab.graph.store.OntologyGraphStore;
import com.eidos.collab.graph.store.RelationshipChange;
import com.eidos.collab.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-ontology broadcast channel.
 * <p>
 * A connection moves from {@link ConnectionState#CONNECTING} to {@link ConnectionState#JOINED} for
 * one ontology at a time and ends {@link ConnectionState#DISCONNECTED}. Mutations are authorized,
 * committed under the ontology's write lock and broadcast to every other subscriber from inside the
 * lock, so all subscribers receive them in commit order. Rejections are thrown to the caller and
 * never broadcast.
 * </p>
 */
public class SynchronizationHub {
    private static final Logger LOG = Logger.getLogger(SynchronizationHub.class);

    private final GraphStoreRegistry stores;
    private final PermissionGate permissions;
    private final SessionRegistry sessions;
    private final SyncSettings settings;
    private final Clock clock;
    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<Long, Set<ClientConnection>> subscribers = new ConcurrentHashMap<>();

    public SynchronizationHub(GraphStoreRegistry stores, PermissionGate permissions, SessionRegistry sessions,
                              SyncSettings settings, Clock clock) {
        this.stores = stores;
        this.permissions = permissions;
        this.sessions = sessions;
        this.settings = settings;
        this.clock = clock;
    }

    public SyncSettings getSettings() {
        return settings;
    }

    public SessionRegistry getSessions() {
        return sessions;
    }

    public ClientConnection openConnection(String userId, String userName) {
        if (userId == null || userId.isBlank()) {
            throw new GraphSyncException(ReasonCode.PERMISSION_DENIED, "Unknown user");
        }
        String connectionId = UUID.randomUUID().toString();
        ClientConnection connection = new ClientConnection(connectionId, userId,
                userName != null && !userName.isBlank() ? userName : userId, clock.instant(),
                settings.outboxCapacity());
        connections.put(connectionId, connection);
        LOG.debugf("Opened connection %s for user %s", connectionId, userId);
        return connection;
    }

    public Optional<ClientConnection> findConnection(String connectionId) {
        return Optional.ofNullable(connectionId).map(connections::get);
    }

    /**
     * Subscribes the connection to the ontology. The joiner receives a {@link PresenceList}, the
     * other members a {@link UserJoined}. A connection joined elsewhere leaves that ontology first.
     *
     * @return the members of the ontology, joiner included, earliest joiner first
     */
    public List<PresenceInfo> joinOntology(String connectionId, long ontologyId) {
        ClientConnection connection = requireConnection(connectionId);
        authorize(connection, ontologyId, Action.VIEW);
        synchronized (connection) {
            // a disconnect that removed the connection first must not be followed by a subscription
            if (connections.get(connectionId) != connection) {
                throw new GraphSyncException(ReasonCode.NOT_FOUND, "Connection " + connectionId + " not found");
            }
            Optional<Long> current = connection.getOntologyId();
            if (current.isPresent() && current.get() == ontologyId) {
                List<PresenceInfo> members = sessions.presence(ontologyId);
                connection.getOutbox().offer(new PresenceList(ontologyId, members));
                return members;
            }
            current.ifPresent(other -> depart(connection, other, LeaveReason.LEFT));
            stores.store(ontologyId);

            Instant now = clock.instant();
            PresenceInfo presence = new PresenceInfo(connectionId, connection.getUserId(), connection.getUserName(),
                    ontologyId, now, now, AvatarColors.forUser(connection.getUserId()), null);
            sessions.register(presence);
            subscribers.compute(ontologyId, (id, members) -> {
                Set<ClientConnection> joined = members != null ? members : ConcurrentHashMap.newKeySet();
                joined.add(connection);
                return joined;
            });
            connection.joined(ontologyId);

            List<PresenceInfo> members = sessions.presence(ontologyId);
            connection.getOutbox().offer(new PresenceList(ontologyId, members));
            broadcast(ontologyId, new UserJoined(ontologyId, presence), connectionId);
            LOG.infof("User %s joined ontology %d on connection %s", connection.getUserId(), ontologyId, connectionId);
            return members;
        }
    }

    public void leaveOntology(String connectionId, long ontologyId) {
        ClientConnection connection = requireConnection(connectionId);
        synchronized (connection) {
            if (!connection.isJoinedTo(ontologyId)) {
                LOG.debugf("Connection %s is not joined to ontology %d, nothing to leave", connectionId, ontologyId);
                return;
            }
            depart(connection, ontologyId, LeaveReason.LEFT);
        }
    }

    public void disconnect(String connectionId) {
        disconnect(connectionId, LeaveReason.DISCONNECTED);
    }

    private void disconnect(String connectionId, LeaveReason reason) {
        ClientConnection connection = connectionId != null ? connections.remove(connectionId) : null;
        if (connection == null) {
            return;
        }
        synchronized (connection) {
            connection.getOntologyId().ifPresent(ontologyId -> depart(connection, ontologyId, reason));
            connection.disconnected();
        }
        LOG.debugf("Connection %s closed (%s)", connectionId, reason);
    }

    private void depart(ClientConnection connection, long ontologyId, LeaveReason reason) {
        unsubscribe(ontologyId, connection.getConnectionId());
        sessions.remove(connection.getConnectionId());
        connection.left();
        broadcast(ontologyId, new UserLeft(ontologyId, connection.getConnectionId(), connection.getUserId(),
                connection.getUserName(), reason), connection.getConnectionId());
        LOG.infof("User %s left ontology %d (%s)", connection.getUserId(), ontologyId, reason);
    }

    /**
     * Removes the connection from the ontology's subscribers. The last one out releases the
     * ontology's store.
     */
    private void unsubscribe(long ontologyId, String connectionId) {
        Set<ClientConnection> remaining = subscribers.computeIfPresent(ontologyId, (id, members) -> {
            members.removeIf(member -> member.getConnectionId().equals(connectionId));
            return members.isEmpty() ? null : members;
        });
        if (remaining == null) {
            stores.release(ontologyId).whenComplete((released, failure) -> {
                if (failure != null) {
                    ExceptionLoggingUtils.logWarn(LOG, failure, "Ontology %d could not be released", ontologyId);
                }
            });
        }
    }

    public ConceptChanged proposeConceptChange(String connectionId, long ontologyId, ConceptChange change) {
        ClientConnection connection = requireJoined(connectionId, ontologyId);
        authorize(connection, ontologyId, actionFor(ontologyId, change.changeType()));
        return this.<Concept, ConceptChanged>commitAndBroadcast(connection, ontologyId,
                tx -> GraphMutations.applyConceptChange(tx, change),
                commit -> new ConceptChanged(ontologyId, commit.revision(), change.changeType(), commit.result(),
                        commit.delta(), connectionId, change.clientRequestId()));
    }

    public RelationshipChanged proposeRelationshipChange(String connectionId, long ontologyId,
                                                         RelationshipChange change) {
        ClientConnection connection = requireJoined(connectionId, ontologyId);
        authorize(connection, ontologyId, actionFor(ontologyId, change.changeType()));
        return this.<Relationship, RelationshipChanged>commitAndBroadcast(connection, ontologyId,
                tx -> GraphMutations.applyRelationshipChange(tx, change),
                commit -> new RelationshipChanged(ontologyId, commit.revision(), change.changeType(), commit.result(),
                        commit.delta(), connectionId, change.clientRequestId()));
    }

    public IndividualChanged proposeIndividualChange(String connectionId, long ontologyId, IndividualChange change) {
        ClientConnection connection = requireJoined(connectionId, ontologyId);
        authorize(connection, ontologyId, actionFor(ontologyId, change.changeType()));
        return this.<Individual, IndividualChanged>commitAndBroadcast(connection, ontologyId,
                tx -> GraphMutations.applyIndividualChange(tx, change),
                commit -> new IndividualChanged(ontologyId, commit.revision(), change.changeType(), commit.result(),
                        commit.delta(), connectionId, change.clientRequestId()));
    }

    public IndividualRelationshipChanged proposeIndividualRelationshipChange(String connectionId, long ontologyId,
                                                                             IndividualRelationshipChange change) {
        ClientConnection connection = requireJoined(connectionId, ontologyId);
        authorize(connection, ontologyId, actionFor(ontologyId, change.changeType()));
        return this.<IndividualRelationship, IndividualRelationshipChanged>commitAndBroadcast(connection, ontologyId,
                tx -> GraphMutations.applyIndividualRelationshipChange(tx, change),
                commit -> new IndividualRelationshipChanged(ontologyId, commit.revision(), change.changeType(),
                        commit.result(), commit.delta(), connectionId, change.clientRequestId()));
    }

    /**
     * Applies a group operation. Toggling a group into the state it is already in commits nothing and
     * is returned to the caller without a broadcast.
     */
    public GroupChanged proposeGroupChange(String connectionId, long ontologyId, GroupChange change) {
        ClientConnection connection = requireJoined(connectionId, ontologyId);
        authorize(connection, ontologyId, Action.EDIT);
        OntologyGraphStore store = stores.store(ontologyId);
        return this.<GroupChangeResult, GroupChanged>commitAndBroadcast(connection, ontologyId,
                tx -> store.getGrouping().apply(tx, connection.getUserId(), change),
                commit -> {
                    GroupChangeResult result = commit.result();
                    return new GroupChanged(ontologyId, commit.revision(), result.changeType(), result.action(),
                            result.group(), result.expansion(), commit.delta(), connectionId,
                            change.clientRequestId());
                });
    }

    /**
     * Read-only check before a grouping gesture completes. Never throws; answers false for an
     * unknown connection or a user without view access.
     */
    public boolean canCreateGroup(String connectionId, long ontologyId, long parentConceptId,
                                  Collection<Long> candidateChildIds) {
        ClientConnection connection = findConnection(connectionId).orElse(null);
        if (connection == null) {
            return false;
        }
        AuthorizationDecision decision = permissions.authorize(connection.getUserId(), ontologyId, Action.VIEW);
        if (!decision.allowed()) {
            return false;
        }
        Optional<OntologyGraphStore> store = stores.find(ontologyId);
        return store.isPresent() && store.get().canCreateGroup(parentConceptId, candidateChildIds);
    }

    /**
     * @return false when the connection is not joined to the ontology
     */
    public boolean heartbeat(String connectionId, long ontologyId) {
        ClientConnection connection = findConnection(connectionId).orElse(null);
        if (connection == null || !connection.isJoinedTo(ontologyId)) {
            LOG.debugf("Heartbeat from connection %s ignored, not joined to ontology %d", connectionId, ontologyId);
            return false;
        }
        return sessions.touch(connectionId, clock.instant()).isPresent();
    }

    /**
     * Records which view the user is looking at and tells the other members. Blank or over-long
     * names are ignored.
     *
     * @return whether the view was accepted
     */
    public boolean updateCurrentView(String connectionId, long ontologyId, String viewName) {
        ClientConnection connection = findConnection(connectionId).orElse(null);
        if (connection == null || !connection.isJoinedTo(ontologyId)) {
            LOG.debugf("View update from connection %s ignored, not joined to ontology %d", connectionId, ontologyId);
            return false;
        }
        if (viewName == null || viewName.isBlank() || viewName.length() > settings.maxViewNameLength()) {
            LOG.warnf("Invalid view name from connection %s on ontology %d ignored", connectionId, ontologyId);
            return false;
        }
        Optional<PresenceInfo> updated = sessions.updateView(connectionId, viewName, clock.instant());
        if (updated.isEmpty()) {
            return false;
        }
        broadcast(ontologyId, new UserViewChanged(ontologyId, connectionId, connection.getUserId(), viewName),
                connectionId);
        return true;
    }

    /**
     * Current state of the ontology. Clears the connection's pending resync flag.
     */
    public HubSnapshot snapshot(String connectionId, long ontologyId) {
        ClientConnection connection = requireConnection(connectionId);
        authorize(connection, ontologyId, Action.VIEW);
        connection.getOutbox().clearResync();
        GraphSnapshot snapshot = stores.store(ontologyId).snapshot();
        return new HubSnapshot(snapshot, VisibleGraph.project(snapshot));
    }

    /**
     * Evicts every connection idle for longer than the presence timeout, with the same
     * {@link UserLeft} a leave produces.
     *
     * @return the evicted entries
     */
    public List<PresenceInfo> evictStale(Instant now) {
        List<PresenceInfo> stale = sessions.findStale(now, settings.presenceTimeout());
        List<PresenceInfo> evicted = new ArrayList<>();
        for (PresenceInfo presence : stale) {
            LOG.infof("Evicting connection %s of user %s from ontology %d, last seen %s",
                    presence.connectionId(), presence.userId(), presence.ontologyId(), presence.lastSeenAt());
            if (connections.containsKey(presence.connectionId())) {
                disconnect(presence.connectionId(), LeaveReason.TIMED_OUT);
            } else if (sessions.remove(presence.connectionId()).isPresent()) {
                unsubscribe(presence.ontologyId(), presence.connectionId());
                broadcast(presence.ontologyId(), new UserLeft(presence.ontologyId(), presence.connectionId(),
                        presence.userId(), presence.userName(), LeaveReason.TIMED_OUT), presence.connectionId());
            }
            evicted.add(presence);
        }
        return evicted;
    }

    public List<String> subscriberIds(long ontologyId) {
        return subscribers.getOrDefault(ontologyId, Set.of()).stream()
                .map(ClientConnection::getConnectionId)
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Ontologies with at least one subscribed connection.
     */
    public Set<Long> activeOntologies() {
        return Set.copyOf(subscribers.keySet());
    }

    private <T, E extends MutationEvent> E commitAndBroadcast(ClientConnection connection, long ontologyId,
                                                              GraphWork<T> work,
                                                              Function<GraphCommit<T>, E> toEvent) {
        OntologyGraphStore store = stores.store(ontologyId);
        AtomicReference<E> published = new AtomicReference<>();
        store.write(work, commit -> {
            E event = toEvent.apply(commit);
            published.set(event);
            if (commit.changed()) {
                broadcast(ontologyId, event, connection.getConnectionId());
            }
        });
        sessions.touch(connection.getConnectionId(), clock.instant());
        return published.get();
    }

    private void broadcast(long ontologyId, HubEvent event, String excludedConnectionId) {
        for (ClientConnection subscriber : subscribers.getOrDefault(ontologyId, Set.of())) {
            if (!subscriber.getConnectionId().equals(excludedConnectionId)) {
                subscriber.getOutbox().offer(event);
            }
        }
    }

    private ClientConnection requireConnection(String connectionId) {
        ClientConnection connection = connectionId != null ? connections.get(connectionId) : null;
        if (connection == null) {
            throw new GraphSyncException(ReasonCode.NOT_FOUND, "Connection " + connectionId + " not found");
        }
        return connection;
    }

    private ClientConnection requireJoined(String connectionId, long ontologyId) {
        ClientConnection connection = requireConnection(connectionId);
        if (!connection.isJoinedTo(ontologyId)) {
            throw GraphSyncException.permissionDenied(ontologyId,
                    "Connection " + connectionId + " has not joined ontology " + ontologyId);
        }
        return connection;
    }

    private void authorize(ClientConnection connection, long ontologyId, Action action) {
        AuthorizationDecision decision = permissions.authorize(connection.getUserId(), ontologyId, action);
        if (!decision.allowed()) {
            LOG.debugf("Rejected %s by user %s on ontology %d: %s", action, connection.getUserId(), ontologyId,
                    decision.deniedReason());
            throw GraphSyncException.permissionDenied(ontologyId, decision.deniedReason());
        }
    }

    private static Action actionFor(long ontologyId, ChangeType changeType) {
        if (changeType == null) {
            throw GraphSyncException.invalidRequest(ontologyId, "Change type is required");
        }
        switch (changeType) {
            case ADDED:
                return Action.ADD;
            case UPDATED:
                return Action.EDIT;
            case DELETED:
                return Action.MANAGE;
            default:
                throw new IllegalArgumentException("Unsupported change type " + changeType);
        }
    }
}
