package com.eidos.collab.graph.store;

import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read access to the graph of one ontology. Implemented by the immutable {@link GraphSnapshot}
 * and by the {@link GraphTransaction} a write works against, so read-only algorithms such as
 * group validation and projection run unchanged on either.
 */
public interface GraphView {

    long ontologyId();

    long revision();

    Optional<Concept> findConcept(long conceptId);

    Optional<Relationship> findRelationship(long relationshipId);

    Optional<Individual> findIndividual(long individualId);

    Optional<IndividualRelationship> findIndividualRelationship(long individualRelationshipId);

    Optional<ConceptGroup> findGroup(long groupId);

    Collection<Concept> concepts();

    Collection<Relationship> relationships();

    Collection<Individual> individuals();

    Collection<IndividualRelationship> individualRelationships();

    Collection<ConceptGroup> groups();

    default boolean hasConcept(long conceptId) {
        return findConcept(conceptId).isPresent();
    }

    default boolean hasIndividual(long individualId) {
        return findIndividual(individualId).isPresent();
    }

    /**
     * The group whose child set contains the concept. Child sets are disjoint so there is at most one.
     */
    default Optional<ConceptGroup> findGroupContainingChild(long conceptId) {
        for (ConceptGroup group : groups()) {
            if (group.containsChild(conceptId)) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    /**
     * The group represented by the concept. Creating a group for a parent that already has one
     * extends that group, so there is at most one.
     */
    default Optional<ConceptGroup> findGroupByParent(long parentConceptId) {
        for (ConceptGroup group : groups()) {
            if (group.parentConceptId() == parentConceptId) {
                return Optional.of(group);
            }
        }
        return Optional.empty();
    }

    default List<Relationship> relationshipsTouching(Collection<Long> conceptIds) {
        return relationships().stream()
                .filter(r -> conceptIds.contains(r.sourceConceptId()) || conceptIds.contains(r.targetConceptId()))
                .collect(Collectors.toList());
    }
}
