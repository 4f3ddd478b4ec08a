package com.eidos.collab.graph.hub;

import java.time.Instant;
import java.util.Optional;

/**
 * One client connection: its identity, its outbox and the ontology it has joined, if any.
 */
public class ClientConnection {

    private final String connectionId;
    private final String userId;
    private final String userName;
    private final Instant openedAt;
    private final ConnectionOutbox outbox;
    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile Long ontologyId;

    public ClientConnection(String connectionId, String userId, String userName, Instant openedAt, int outboxCapacity) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.userName = userName;
        this.openedAt = openedAt;
        this.outbox = new ConnectionOutbox(connectionId, outboxCapacity);
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getUserName() {
        return userName;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public ConnectionOutbox getOutbox() {
        return outbox;
    }

    public ConnectionState getState() {
        return state;
    }

    public Optional<Long> getOntologyId() {
        return Optional.ofNullable(ontologyId);
    }

    public boolean isJoinedTo(long ontology) {
        Long joined = ontologyId;
        return state == ConnectionState.JOINED && joined != null && joined == ontology;
    }

    synchronized void joined(long ontology) {
        this.ontologyId = ontology;
        this.state = ConnectionState.JOINED;
    }

    synchronized void left() {
        this.ontologyId = null;
        if (state != ConnectionState.DISCONNECTED) {
            this.state = ConnectionState.CONNECTING;
        }
    }

    synchronized void disconnected() {
        this.ontologyId = null;
        this.state = ConnectionState.DISCONNECTED;
    }

    @Override
    public String toString() {
        return "ClientConnection[" + connectionId + ", user=" + userId + ", state=" + state + "]";
    }
}
