package com.eidos.collab.graph.store;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable working copy of a {@link GraphSnapshot}, confined to the thread holding the ontology's
 * write lock. Nothing is visible to readers until the store publishes {@link #toSnapshot(long)}.
 */
public final class GraphTransaction implements GraphView {

    private final GraphSnapshot base;
    private final Map<Long, Concept> concepts;
    private final Map<Long, Relationship> relationships;
    private final Map<Long, Individual> individuals;
    private final Map<Long, IndividualRelationship> individualRelationships;
    private final Map<Long, ConceptGroup> groups;
    private long nextId;

    private final Set<Long> touchedConcepts = new LinkedHashSet<>();
    private final Set<Long> touchedRelationships = new LinkedHashSet<>();
    private final Set<Long> touchedIndividuals = new LinkedHashSet<>();
    private final Set<Long> touchedIndividualRelationships = new LinkedHashSet<>();
    private final Set<Long> touchedGroups = new LinkedHashSet<>();

    GraphTransaction(GraphSnapshot base) {
        this.base = base;
        this.concepts = new TreeMap<>(base.conceptMap());
        this.relationships = new TreeMap<>(base.relationshipMap());
        this.individuals = new TreeMap<>(base.individualMap());
        this.individualRelationships = new TreeMap<>(base.individualRelationshipMap());
        this.groups = new TreeMap<>(base.groupMap());
        this.nextId = base.nextId();
    }

    /**
     * Reserves an id for a new entity. A proposed id is honoured when no entity of the same kind
     * uses it; otherwise the request is rejected with {@code CONFLICT}.
     */
    long allocateId(Long proposedId, Map<Long, ?> kind, String kindName) {
        if (proposedId == null) {
            long id = nextId;
            while (kind.containsKey(id)) {
                id++;
            }
            nextId = id + 1;
            return id;
        }
        if (proposedId <= 0) {
            throw GraphSyncException.invalidRequest(ontologyId(), kindName + " id must be positive: " + proposedId);
        }
        if (kind.containsKey(proposedId)) {
            throw GraphSyncException.conflict(ontologyId(),
                    String.format("%s %d already exists in ontology %d", kindName, proposedId, ontologyId()));
        }
        nextId = Math.max(nextId, proposedId + 1);
        return proposedId;
    }

    public long allocateConceptId(Long proposedId) {
        return allocateId(proposedId, concepts, "Concept");
    }

    public long allocateRelationshipId(Long proposedId) {
        return allocateId(proposedId, relationships, "Relationship");
    }

    public long allocateIndividualId(Long proposedId) {
        return allocateId(proposedId, individuals, "Individual");
    }

    public long allocateIndividualRelationshipId(Long proposedId) {
        return allocateId(proposedId, individualRelationships, "IndividualRelationship");
    }

    public long allocateGroupId(Long proposedId) {
        return allocateId(proposedId, groups, "ConceptGroup");
    }

    public void putConcept(Concept concept) {
        concepts.put(concept.id(), concept);
        touchedConcepts.add(concept.id());
    }

    public void removeConcept(long conceptId) {
        if (concepts.remove(conceptId) != null) {
            touchedConcepts.add(conceptId);
        }
    }

    public void putRelationship(Relationship relationship) {
        relationships.put(relationship.id(), relationship);
        touchedRelationships.add(relationship.id());
    }

    public void removeRelationship(long relationshipId) {
        if (relationships.remove(relationshipId) != null) {
            touchedRelationships.add(relationshipId);
        }
    }

    public void putIndividual(Individual individual) {
        individuals.put(individual.id(), individual);
        touchedIndividuals.add(individual.id());
    }

    public void removeIndividual(long individualId) {
        if (individuals.remove(individualId) != null) {
            touchedIndividuals.add(individualId);
        }
    }

    public void putIndividualRelationship(IndividualRelationship relationship) {
        individualRelationships.put(relationship.id(), relationship);
        touchedIndividualRelationships.add(relationship.id());
    }

    public void removeIndividualRelationship(long individualRelationshipId) {
        if (individualRelationships.remove(individualRelationshipId) != null) {
            touchedIndividualRelationships.add(individualRelationshipId);
        }
    }

    public void putGroup(ConceptGroup group) {
        groups.put(group.id(), group);
        touchedGroups.add(group.id());
    }

    public void removeGroup(long groupId) {
        if (groups.remove(groupId) != null) {
            touchedGroups.add(groupId);
        }
    }

    public boolean hasChanges() {
        return !touchedConcepts.isEmpty() || !touchedRelationships.isEmpty() || !touchedIndividuals.isEmpty()
                || !touchedIndividualRelationships.isEmpty() || !touchedGroups.isEmpty();
    }

    /**
     * The state the store publishes when this transaction commits.
     */
    GraphSnapshot toSnapshot(long revision) {
        return new GraphSnapshot(base.ontologyId(), revision, nextId, concepts, relationships, individuals,
                individualRelationships, groups);
    }

    GraphDelta toDelta(long revision) {
        List<Concept> upsertedConcepts = new ArrayList<>();
        Set<Long> deletedConcepts = new LinkedHashSet<>();
        split(touchedConcepts, concepts, upsertedConcepts, deletedConcepts);
        List<Relationship> upsertedRelationships = new ArrayList<>();
        Set<Long> deletedRelationships = new LinkedHashSet<>();
        split(touchedRelationships, relationships, upsertedRelationships, deletedRelationships);
        List<Individual> upsertedIndividuals = new ArrayList<>();
        Set<Long> deletedIndividuals = new LinkedHashSet<>();
        split(touchedIndividuals, individuals, upsertedIndividuals, deletedIndividuals);
        List<IndividualRelationship> upsertedIndividualRelationships = new ArrayList<>();
        Set<Long> deletedIndividualRelationships = new LinkedHashSet<>();
        split(touchedIndividualRelationships, individualRelationships, upsertedIndividualRelationships,
                deletedIndividualRelationships);
        List<ConceptGroup> upsertedGroups = new ArrayList<>();
        Set<Long> deletedGroups = new LinkedHashSet<>();
        split(touchedGroups, groups, upsertedGroups, deletedGroups);
        return new GraphDelta(base.ontologyId(), revision, nextId,
                upsertedConcepts, deletedConcepts,
                upsertedRelationships, deletedRelationships,
                upsertedIndividuals, deletedIndividuals,
                upsertedIndividualRelationships, deletedIndividualRelationships,
                upsertedGroups, deletedGroups);
    }

    private static <T> void split(Set<Long> touched, Map<Long, T> current, List<T> upserts, Set<Long> deletes) {
        for (Long id : touched) {
            T entity = current.get(id);
            if (entity != null) {
                upserts.add(entity);
            } else {
                deletes.add(id);
            }
        }
    }

    @Override
    public long ontologyId() {
        return base.ontologyId();
    }

    /**
     * Revision of the snapshot this transaction started from.
     */
    @Override
    public long revision() {
        return base.revision();
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
        return List.copyOf(concepts.values());
    }

    @Override
    public Collection<Relationship> relationships() {
        return List.copyOf(relationships.values());
    }

    @Override
    public Collection<Individual> individuals() {
        return List.copyOf(individuals.values());
    }

    @Override
    public Collection<IndividualRelationship> individualRelationships() {
        return List.copyOf(individualRelationships.values());
    }

    @Override
    public Collection<ConceptGroup> groups() {
        return List.copyOf(groups.values());
    }
}
