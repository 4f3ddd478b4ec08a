package com.eidos.collab.graph.mongo.model;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted concept. The id combines ontology and concept id so ids stay unique across ontologies.
 */
@Data
@NoArgsConstructor
@Entity(value = "concepts", useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "idx_concepts_ontology"), fields = {@Field("ontologyId")})
})
public class ConceptDocument {

    @Id
    private String id;
    private long ontologyId;
    private long conceptId;
    private String name;
    private String category;
    private String color;
    private String definition;
    private Double x;
    private Double y;
    private long version;
}
