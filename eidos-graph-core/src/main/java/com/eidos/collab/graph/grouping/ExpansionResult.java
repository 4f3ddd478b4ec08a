package com.eidos.collab.graph.grouping;

import com.eidos.collab.graph.model.Position;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What expanding a group changed in the visible graph.
 *
 * @param groupId the expanded group
 * @param revealedConceptIds concepts visible after but not before, ascending
 * @param removedSyntheticEdgeIds rerouted edges visible before but not after
 * @param restoredRelationshipIds relationships drawn between their own endpoints again
 * @param positions committed placement of each revealed concept
 */
public record ExpansionResult(long groupId,
                              List<Long> revealedConceptIds,
                              List<String> removedSyntheticEdgeIds,
                              List<Long> restoredRelationshipIds,
                              Map<Long, Position> positions) {

    public ExpansionResult {
        revealedConceptIds = List.copyOf(revealedConceptIds);
        removedSyntheticEdgeIds = List.copyOf(removedSyntheticEdgeIds);
        restoredRelationshipIds = List.copyOf(restoredRelationshipIds);
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    }

    public static ExpansionResult none(long groupId) {
        return new ExpansionResult(groupId, List.of(), List.of(), List.of(), Map.of());
    }
}
