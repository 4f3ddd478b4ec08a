package com.eidos.collab.graph.view;

import com.eidos.collab.graph.hub.event.HubEvent;

@FunctionalInterface
public interface ViewStateListener {

    /**
     * @param cause the applied event, or null when a snapshot replaced the state
     */
    void onChange(OntologyViewState state, HubEvent cause);
}
