package com.eidos.collab.graph.store;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.Position;

/**
 * A proposed individual mutation. On update, null fields keep their current value.
 */
public record IndividualChange(ChangeType changeType,
                               Long individualId,
                               Long conceptTypeId,
                               String name,
                               Position position,
                               Long expectedVersion,
                               String clientRequestId) {

    public static IndividualChange create(Long individualId, long conceptTypeId, String name) {
        return new IndividualChange(ChangeType.ADDED, individualId, conceptTypeId, name, null, null, null);
    }

    public static IndividualChange delete(long individualId) {
        return new IndividualChange(ChangeType.DELETED, individualId, null, null, null, null, null);
    }
}
