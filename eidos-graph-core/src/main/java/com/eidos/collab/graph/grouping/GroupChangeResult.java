package com.eidos.collab.graph.grouping;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.ConceptGroup;

/**
 * Outcome of one group operation.
 *
 * @param group the group after the change, or as it was before deletion
 * @param expansion set when the operation revealed concepts, otherwise null
 * @param changed false for no-op toggles, which are neither committed nor broadcast
 */
public record GroupChangeResult(GroupAction action,
                                ChangeType changeType,
                                ConceptGroup group,
                                ExpansionResult expansion,
                                boolean changed) {
}
