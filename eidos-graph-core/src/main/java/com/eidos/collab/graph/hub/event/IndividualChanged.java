package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.store.GraphDelta;

public record IndividualChanged(long ontologyId,
                                long revision,
                                ChangeType changeType,
                                Individual individual,
                                GraphDelta delta,
                                String originatorConnectionId,
                                String clientRequestId) implements MutationEvent {
}
