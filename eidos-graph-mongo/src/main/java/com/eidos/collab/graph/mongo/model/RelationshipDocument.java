package com.eidos.collab.graph.mongo.model;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@Entity(value = "relationships", useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "idx_relationships_ontology"), fields = {@Field("ontologyId")}),
    // cascade lookups by endpoint
    @Index(options = @IndexOptions(name = "idx_relationships_source"),
           fields = {@Field("ontologyId"), @Field("sourceConceptId")}),
    @Index(options = @IndexOptions(name = "idx_relationships_target"),
           fields = {@Field("ontologyId"), @Field("targetConceptId")})
})
public class RelationshipDocument {

    @Id
    private String id;
    private long ontologyId;
    private long relationshipId;
    private long sourceConceptId;
    private long targetConceptId;
    private String relationType;
    private long version;
}
