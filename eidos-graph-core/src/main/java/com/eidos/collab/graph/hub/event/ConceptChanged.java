package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.store.GraphDelta;

public record ConceptChanged(long ontologyId,
                             long revision,
                             ChangeType changeType,
                             Concept concept,
                             GraphDelta delta,
                             String originatorConnectionId,
                             String clientRequestId) implements MutationEvent {
}
