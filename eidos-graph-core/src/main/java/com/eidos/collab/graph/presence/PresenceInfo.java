package com.eidos.collab.graph.presence;

import java.time.Instant;

/**
 * One connected user as seen by the other members of an ontology.
 */
public record PresenceInfo(String connectionId,
                           String userId,
                           String userName,
                           long ontologyId,
                           Instant joinedAt,
                           Instant lastSeenAt,
                           String color,
                           String currentView) {

    public PresenceInfo withLastSeenAt(Instant seen) {
        return new PresenceInfo(connectionId, userId, userName, ontologyId, joinedAt, seen, color, currentView);
    }

    public PresenceInfo withCurrentView(String view, Instant seen) {
        return new PresenceInfo(connectionId, userId, userName, ontologyId, joinedAt, seen, color, view);
    }
}
