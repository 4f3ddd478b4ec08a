package com.eidos.collab.graph.model;

import java.util.Objects;

/**
 * A directed, typed edge between two individuals.
 */
public record IndividualRelationship(long id,
                                     long ontologyId,
                                     long sourceIndividualId,
                                     long targetIndividualId,
                                     String relationType,
                                     long version) {

    public IndividualRelationship {
        Objects.requireNonNull(relationType, "relationType");
    }

    public boolean touches(long individualId) {
        return sourceIndividualId == individualId || targetIndividualId == individualId;
    }
}
