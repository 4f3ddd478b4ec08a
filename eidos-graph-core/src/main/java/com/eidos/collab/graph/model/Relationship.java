package com.eidos.collab.graph.model;

import java.util.Objects;

/**
 * A directed, typed edge between two concepts of the same ontology.
 */
public record Relationship(long id,
                           long ontologyId,
                           long sourceConceptId,
                           long targetConceptId,
                           String relationType,
                           long version) {

    public Relationship {
        Objects.requireNonNull(relationType, "relationType");
    }

    public boolean touches(long conceptId) {
        return sourceConceptId == conceptId || targetConceptId == conceptId;
    }
}
