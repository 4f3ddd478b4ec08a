package com.eidos.collab.graph.store;

import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.ToLongFunction;

/**
 * Immutable state of one ontology at a given revision. Published by {@link OntologyGraphStore}
 * after every commit and handed to readers as is; nothing reachable from a snapshot can be mutated.
 */
public final class GraphSnapshot implements GraphView {

    private final long ontologyId;
    private final long revision;
    private final long nextId;
    private final SortedMap<Long, Concept> concepts;
    private final SortedMap<Long, Relationship> relationships;
    private final SortedMap<Long, Individual> individuals;
    private final SortedMap<Long, IndividualRelationship> individualRelationships;
    private final SortedMap<Long, ConceptGroup> groups;

    public GraphSnapshot(long ontologyId,
                         long revision,
                         long nextId,
                         Map<Long, Concept> concepts,
                         Map<Long, Relationship> relationships,
                         Map<Long, Individual> individuals,
                         Map<Long, IndividualRelationship> individualRelationships,
                         Map<Long, ConceptGroup> groups) {
        this.ontologyId = ontologyId;
        this.revision = revision;
        this.nextId = nextId;
        this.concepts = Collections.unmodifiableSortedMap(new TreeMap<>(concepts));
        this.relationships = Collections.unmodifiableSortedMap(new TreeMap<>(relationships));
        this.individuals = Collections.unmodifiableSortedMap(new TreeMap<>(individuals));
        this.individualRelationships = Collections.unmodifiableSortedMap(new TreeMap<>(individualRelationships));
        this.groups = Collections.unmodifiableSortedMap(new TreeMap<>(groups));
    }

    public static GraphSnapshot empty(long ontologyId) {
        return new GraphSnapshot(ontologyId, 0L, 1L, Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    /**
     * Applies a committed delta on top of this snapshot. Used by repositories that keep whole
     * snapshots rather than rows.
     */
    public GraphSnapshot withDelta(GraphDelta delta) {
        return new GraphSnapshot(ontologyId, Math.max(revision, delta.revision()), Math.max(nextId, delta.nextId()),
                merge(concepts, delta.concepts(), delta.deletedConceptIds(), Concept::id),
                merge(relationships, delta.relationships(), delta.deletedRelationshipIds(), Relationship::id),
                merge(individuals, delta.individuals(), delta.deletedIndividualIds(), Individual::id),
                merge(individualRelationships, delta.individualRelationships(),
                        delta.deletedIndividualRelationshipIds(), IndividualRelationship::id),
                merge(groups, delta.groups(), delta.deletedGroupIds(), ConceptGroup::id));
    }

    private static <T> Map<Long, T> merge(Map<Long, T> base, Collection<T> upserts, Collection<Long> deletes,
                                          ToLongFunction<T> id) {
        Map<Long, T> merged = new TreeMap<>(base);
        deletes.forEach(merged::remove);
        for (T entity : upserts) {
            merged.put(id.applyAsLong(entity), entity);
        }
        return merged;
    }

    @Override
    public long ontologyId() {
        return ontologyId;
    }

    @Override
    public long revision() {
        return revision;
    }

    /**
     * The id the store assigns to the next created entity unless the client proposes a free one.
     */
    public long nextId() {
        return nextId;
    }

    @Override
    public Optional<Concept> findConcept(long conceptId) {
        return Optional.ofNullable(concepts.get(conceptId));
    }

    @Override
    public Optional<Relationship> findRelationship(long relationshipId) {
        return Optional.ofNullable(relationships.get(relationshipId));
    }

    @Override
    public Optional<Individual> findIndividual(long individualId) {
        return Optional.ofNullable(individuals.get(individualId));
    }

    @Override
    public Optional<IndividualRelationship> findIndividualRelationship(long individualRelationshipId) {
        return Optional.ofNullable(individualRelationships.get(individualRelationshipId));
    }

    @Override
    public Optional<ConceptGroup> findGroup(long groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    @Override
    public Collection<Concept> concepts() {
        return concepts.values();
    }

    @Override
    public Collection<Relationship> relationships() {
        return relationships.values();
    }

    @Override
    public Collection<Individual> individuals() {
        return individuals.values();
    }

    @Override
    public Collection<IndividualRelationship> individualRelationships() {
        return individualRelationships.values();
    }

    @Override
    public Collection<ConceptGroup> groups() {
        return groups.values();
    }

    SortedMap<Long, Concept> conceptMap() {
        return concepts;
    }

    SortedMap<Long, Relationship> relationshipMap() {
        return relationships;
    }

    SortedMap<Long, Individual> individualMap() {
        return individuals;
    }

    SortedMap<Long, IndividualRelationship> individualRelationshipMap() {
        return individualRelationships;
    }

    SortedMap<Long, ConceptGroup> groupMap() {
        return groups;
    }

    @Override
    public String toString() {
        return String.format("GraphSnapshot[ontology=%d, revision=%d, concepts=%d, relationships=%d, individuals=%d, groups=%d]",
                ontologyId, revision, concepts.size(), relationships.size(), individuals.size(), groups.size());
    }
}
