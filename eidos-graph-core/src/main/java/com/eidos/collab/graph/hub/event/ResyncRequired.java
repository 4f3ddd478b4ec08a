package com.eidos.collab.graph.hub.event;

/**
 * Tells a client that events were dropped from its outbox and it must fetch a fresh snapshot.
 *
 * @param droppedEvents number of events dropped since the last successful delivery
 */
public record ResyncRequired(long ontologyId, long droppedEvents) implements HubEvent {
}
