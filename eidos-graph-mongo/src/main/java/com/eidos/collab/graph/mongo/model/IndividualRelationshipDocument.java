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
@Entity(value = "individual_relationships", useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "idx_individual_relationships_ontology"), fields = {@Field("ontologyId")})
})
public class IndividualRelationshipDocument {

    @Id
    private String id;
    private long ontologyId;
    private long individualRelationshipId;
    private long sourceIndividualId;
    private long targetIndividualId;
    private String relationType;
    private long version;
}
