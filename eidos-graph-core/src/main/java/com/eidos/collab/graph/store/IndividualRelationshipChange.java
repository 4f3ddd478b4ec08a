package com.eidos.collab.graph.store;

import com.eidos.collab.graph.model.ChangeType;

public record IndividualRelationshipChange(ChangeType changeType,
                                           Long individualRelationshipId,
                                           Long sourceIndividualId,
                                           Long targetIndividualId,
                                           String relationType,
                                           Long expectedVersion,
                                           String clientRequestId) {

    public static IndividualRelationshipChange create(Long id, long sourceIndividualId, long targetIndividualId,
                                                      String relationType) {
        return new IndividualRelationshipChange(ChangeType.ADDED, id, sourceIndividualId, targetIndividualId,
                relationType, null, null);
    }

    public static IndividualRelationshipChange delete(long id) {
        return new IndividualRelationshipChange(ChangeType.DELETED, id, null, null, null, null, null);
    }
}
