package com.eidos.collab.graph.hub.event;

public record UserLeft(long ontologyId,
                       String connectionId,
                       String userId,
                       String userName,
                       LeaveReason reason) implements HubEvent {
}
