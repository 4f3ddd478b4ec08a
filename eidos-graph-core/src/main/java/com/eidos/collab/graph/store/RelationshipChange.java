package com.eidos.collab.graph.store;

import com.eidos.collab.graph.model.ChangeType;

/**
 * A proposed relationship mutation. On update, null fields keep their current value, so a
 * relationship can be re-pointed or relabelled independently.
 */
public record RelationshipChange(ChangeType changeType,
                                 Long relationshipId,
                                 Long sourceConceptId,
                                 Long targetConceptId,
                                 String relationType,
                                 Long expectedVersion,
                                 String clientRequestId) {

    public static RelationshipChange create(Long relationshipId, long sourceConceptId, long targetConceptId,
                                            String relationType) {
        return new RelationshipChange(ChangeType.ADDED, relationshipId, sourceConceptId, targetConceptId,
                relationType, null, null);
    }

    public static RelationshipChange delete(long relationshipId) {
        return new RelationshipChange(ChangeType.DELETED, relationshipId, null, null, null, null, null);
    }

    public RelationshipChange withClientRequestId(String requestId) {
        return new RelationshipChange(changeType, relationshipId, sourceConceptId, targetConceptId, relationType,
                expectedVersion, requestId);
    }
}
