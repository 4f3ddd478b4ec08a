package com.eidos.collab.graph.mongo.model;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Id;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Date;

/**
 * Revision and id counter of one ontology's graph. Its presence marks the ontology as persisted.
 */
@Data
@NoArgsConstructor
@Entity(value = "ontology_graph_meta", useDiscriminator = false)
public class OntologyGraphMetaDocument {

    @Id
    private long ontologyId;
    private long revision;
    private long nextId;
    private Date updatedAt;
}
