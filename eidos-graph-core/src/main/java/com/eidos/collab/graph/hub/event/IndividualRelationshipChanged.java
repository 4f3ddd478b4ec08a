package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.store.GraphDelta;

public record IndividualRelationshipChanged(long ontologyId,
                                            long revision,
                                            ChangeType changeType,
                                            IndividualRelationship individualRelationship,
                                            GraphDelta delta,
                                            String originatorConnectionId,
                                            String clientRequestId) implements MutationEvent {
}
