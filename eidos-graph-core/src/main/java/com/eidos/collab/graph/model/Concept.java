package com.eidos.collab.graph.model;

import java.util.Objects;

/**
 * A class or category node of an ontology.
 */
public record Concept(long id,
                      long ontologyId,
                      String name,
                      String category,
                      String color,
                      String definition,
                      Position position,
                      long version) {

    public Concept {
        Objects.requireNonNull(name, "name");
    }

    public Concept withPosition(Position newPosition) {
        return new Concept(id, ontologyId, name, category, color, definition, newPosition, version + 1);
    }
}
