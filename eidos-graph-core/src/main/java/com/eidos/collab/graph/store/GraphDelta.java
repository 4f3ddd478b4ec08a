package com.eidos.collab.graph.store;

import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Set;

/**
 * Everything one commit changed: the upserted entities and the deleted ids per entity kind,
 * cascades included. Handed to the persistence writer and carried by mutation events.
 */
public record GraphDelta(long ontologyId,
                         long revision,
                         long nextId,
                         List<Concept> concepts,
                         Set<Long> deletedConceptIds,
                         List<Relationship> relationships,
                         Set<Long> deletedRelationshipIds,
                         List<Individual> individuals,
                         Set<Long> deletedIndividualIds,
                         List<IndividualRelationship> individualRelationships,
                         Set<Long> deletedIndividualRelationshipIds,
                         List<ConceptGroup> groups,
                         Set<Long> deletedGroupIds) {

    public GraphDelta {
        concepts = List.copyOf(concepts);
        deletedConceptIds = Set.copyOf(deletedConceptIds);
        relationships = List.copyOf(relationships);
        deletedRelationshipIds = Set.copyOf(deletedRelationshipIds);
        individuals = List.copyOf(individuals);
        deletedIndividualIds = Set.copyOf(deletedIndividualIds);
        individualRelationships = List.copyOf(individualRelationships);
        deletedIndividualRelationshipIds = Set.copyOf(deletedIndividualRelationshipIds);
        groups = List.copyOf(groups);
        deletedGroupIds = Set.copyOf(deletedGroupIds);
    }

    public static GraphDelta empty(long ontologyId, long revision, long nextId) {
        return new GraphDelta(ontologyId, revision, nextId, List.of(), Set.of(), List.of(), Set.of(),
                List.of(), Set.of(), List.of(), Set.of(), List.of(), Set.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return concepts.isEmpty() && deletedConceptIds.isEmpty()
                && relationships.isEmpty() && deletedRelationshipIds.isEmpty()
                && individuals.isEmpty() && deletedIndividualIds.isEmpty()
                && individualRelationships.isEmpty() && deletedIndividualRelationshipIds.isEmpty()
                && groups.isEmpty() && deletedGroupIds.isEmpty();
    }
}
