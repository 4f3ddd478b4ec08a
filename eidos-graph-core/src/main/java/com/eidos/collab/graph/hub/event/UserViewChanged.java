package com.eidos.collab.graph.hub.event;

public record UserViewChanged(long ontologyId,
                              String connectionId,
                              String userId,
                              String viewName) implements HubEvent {
}
