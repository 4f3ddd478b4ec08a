package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.presence.PresenceInfo;

import java.util.List;

/**
 * Members of an ontology at the time the receiver joined, earliest joiner first.
 */
public record PresenceList(long ontologyId, List<PresenceInfo> users) implements HubEvent {

    public PresenceList {
        users = List.copyOf(users);
    }
}
