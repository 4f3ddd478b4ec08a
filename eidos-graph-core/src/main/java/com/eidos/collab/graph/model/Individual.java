package com.eidos.collab.graph.model;

import java.util.Objects;

/**
 * An instance of a concept. Shown in the graph but never part of a group.
 */
public record Individual(long id,
                         long ontologyId,
                         long conceptTypeId,
                         String name,
                         Position position,
                         long version) {

    public Individual {
        Objects.requireNonNull(name, "name");
    }
}
