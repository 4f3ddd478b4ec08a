package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.store.GraphDelta;

public record RelationshipChanged(long ontologyId,
                                  long revision,
                                  ChangeType changeType,
                                  Relationship relationship,
                                  GraphDelta delta,
                                  String originatorConnectionId,
                                  String clientRequestId) implements MutationEvent {
}
