package com.eidos.collab.graph.hub.event;

import com.eidos.collab.graph.grouping.ExpansionResult;
import com.eidos.collab.graph.grouping.GroupAction;
import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.store.GraphDelta;

/**
 * A committed group operation.
 *
 * @param group the group after the change, or as it was before deletion
 * @param expansion revealed concepts and removed rerouted edges, when the operation revealed any
 */
public record GroupChanged(long ontologyId,
                           long revision,
                           ChangeType changeType,
                           GroupAction action,
                           ConceptGroup group,
                           ExpansionResult expansion,
                           GraphDelta delta,
                           String originatorConnectionId,
                           String clientRequestId) implements MutationEvent {
}
