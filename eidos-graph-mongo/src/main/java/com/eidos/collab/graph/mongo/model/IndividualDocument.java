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
@Entity(value = "individuals", useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "idx_individuals_ontology"), fields = {@Field("ontologyId")})
})
public class IndividualDocument {

    @Id
    private String id;
    private long ontologyId;
    private long individualId;
    private long conceptTypeId;
    private String name;
    private Double x;
    private Double y;
    private long version;
}
