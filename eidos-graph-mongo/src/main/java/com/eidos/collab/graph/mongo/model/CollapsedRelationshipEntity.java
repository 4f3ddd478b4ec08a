package com.eidos.collab.graph.mongo.model;

import dev.morphia.annotations.Entity;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Embedded in {@link ConceptGroupDocument}; one per relationship captured when the group collapsed.
 */
@Data
@NoArgsConstructor
@Entity(useDiscriminator = false)
public class CollapsedRelationshipEntity {

    private long relationshipId;
    private String relationType;
    private long sourceConceptId;
    private long targetConceptId;
    private Long externalConceptId;
    private boolean fromGroupedChild;
    private boolean toGroupedChild;
    private boolean shouldBeRerouted;
}
