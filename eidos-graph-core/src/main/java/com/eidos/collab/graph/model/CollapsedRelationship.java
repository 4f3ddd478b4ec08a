package com.eidos.collab.graph.model;

import java.util.Set;

/**
 * Snapshot of one relationship taken when its group was collapsed. Replaying the list of
 * records of a group restores exactly the relationship set that existed before the collapse.
 *
 * @param relationshipId id of the hidden relationship
 * @param relationType type label at collapse time
 * @param sourceConceptId original source endpoint
 * @param targetConceptId original target endpoint
 * @param externalConceptId endpoint outside the group, or null when both endpoints are grouped
 * @param fromGroupedChild whether the source endpoint is inside the group
 * @param toGroupedChild whether the target endpoint is inside the group
 * @param shouldBeRerouted true for boundary relationships that are shown as a rerouted edge
 */
public record CollapsedRelationship(long relationshipId,
                                    String relationType,
                                    long sourceConceptId,
                                    long targetConceptId,
                                    Long externalConceptId,
                                    boolean fromGroupedChild,
                                    boolean toGroupedChild,
                                    boolean shouldBeRerouted) {

    /**
     * Classifies a relationship against the set of grouped concepts (parent and children).
     */
    public static CollapsedRelationship capture(Relationship relationship, Set<Long> groupedConceptIds) {
        boolean fromGrouped = groupedConceptIds.contains(relationship.sourceConceptId());
        boolean toGrouped = groupedConceptIds.contains(relationship.targetConceptId());
        Long external = null;
        if (fromGrouped && !toGrouped) {
            external = relationship.targetConceptId();
        } else if (!fromGrouped && toGrouped) {
            external = relationship.sourceConceptId();
        }
        return new CollapsedRelationship(relationship.id(), relationship.relationType(),
                relationship.sourceConceptId(), relationship.targetConceptId(),
                external, fromGrouped, toGrouped, external != null);
    }

    /**
     * A record is stale when its relationship no longer has the endpoints it was captured with,
     * or no longer touches the grouped concepts.
     */
    public boolean matches(Relationship relationship, Set<Long> groupedConceptIds) {
        if (relationship == null || relationship.id() != relationshipId) {
            return false;
        }
        if (relationship.sourceConceptId() != sourceConceptId || relationship.targetConceptId() != targetConceptId) {
            return false;
        }
        return groupedConceptIds.contains(sourceConceptId) || groupedConceptIds.contains(targetConceptId);
    }
}
