package com.eidos.collab.graph.mongo.model;

import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Field;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Index;
import dev.morphia.annotations.IndexOptions;
import dev.morphia.annotations.Indexes;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@Entity(value = "concept_groups", useDiscriminator = false)
@Indexes({
    @Index(options = @IndexOptions(name = "idx_groups_ontology"), fields = {@Field("ontologyId")}),
    // at most one group per parent concept
    @Index(options = @IndexOptions(name = "uniq_groups_parent", unique = true),
           fields = {@Field("ontologyId"), @Field("parentConceptId")})
})
public class ConceptGroupDocument {

    @Id
    private String id;
    private long ontologyId;
    private long groupId;
    private String createdBy;
    private long parentConceptId;
    private List<Long> childConceptIds = new ArrayList<>();
    private boolean collapsed;
    private String groupName;
    private List<CollapsedRelationshipEntity> collapsedRelationships = new ArrayList<>();
    private long version;
}
