package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.presence.PresenceInfo;

public record UserJoined(long ontologyId, PresenceInfo user) implements HubEvent {
}
