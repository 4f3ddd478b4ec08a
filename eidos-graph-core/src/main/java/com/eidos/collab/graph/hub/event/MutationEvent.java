package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.store.GraphDelta;

/**
 * A committed graph change in its server form.
 */
public interface MutationEvent extends HubEvent {

    /** Revision the commit published. Consecutive per ontology. */
    long revision();

    ChangeType changeType();

    /** Everything the commit changed, cascades included. */
    GraphDelta delta();

    String originatorConnectionId();

    /** The originator's request id, so it can reconcile its optimistic copy. */
    String clientRequestId();
}
