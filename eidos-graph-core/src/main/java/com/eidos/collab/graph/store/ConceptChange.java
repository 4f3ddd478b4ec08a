package com.eidos.collab.graph.store;

import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.Position;

/**
 * A proposed concept mutation. On update, null fields keep their current value.
 *
 * @param changeType added, updated or deleted
 * @param conceptId target id; optional on create, where a free id is honoured
 * @param expectedVersion version the client edited, checked when present
 * @param clientRequestId opaque id echoed back in the committed event
 */
public record ConceptChange(ChangeType changeType,
                            Long conceptId,
                            String name,
                            String category,
                            String color,
                            String definition,
                            Position position,
                            Long expectedVersion,
                            String clientRequestId) {

    public static ConceptChange create(Long conceptId, String name) {
        return new ConceptChange(ChangeType.ADDED, conceptId, name, null, null, null, null, null, null);
    }

    public static ConceptChange rename(long conceptId, String name, Long expectedVersion) {
        return new ConceptChange(ChangeType.UPDATED, conceptId, name, null, null, null, null, expectedVersion, null);
    }

    public static ConceptChange delete(long conceptId) {
        return new ConceptChange(ChangeType.DELETED, conceptId, null, null, null, null, null, null, null);
    }

    public ConceptChange withClientRequestId(String requestId) {
        return new ConceptChange(changeType, conceptId, name, category, color, definition, position,
                expectedVersion, requestId);
    }
}
