package com.eidos.collab.graph.store;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.model.CollapsedRelationship;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import org.jboss.logging.Logger;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies concept, relationship and individual changes to a transaction, enforcing endpoint
 * existence, id uniqueness and optimistic versions, and running the delete cascades.
 * Every method either completes its change or throws before the transaction is committed.
 */
public final class GraphMutations {
    private static final Logger LOG = Logger.getLogger(GraphMutations.class);

    private GraphMutations() {
    }

    public static Concept applyConceptChange(GraphTransaction tx, ConceptChange change) {
        Objects.requireNonNull(change.changeType(), "changeType");
        long ontologyId = tx.ontologyId();
        switch (change.changeType()) {
            case ADDED: {
                requireText(ontologyId, change.name(), "Concept name");
                long id = tx.allocateConceptId(change.conceptId());
                Concept created = new Concept(id, ontologyId, change.name().trim(), change.category(), change.color(),
                        change.definition(), change.position(), 1L);
                tx.putConcept(created);
                return created;
            }
            case UPDATED: {
                Concept current = requireConcept(tx, change.conceptId());
                checkVersion(ontologyId, "Concept", current.id(), change.expectedVersion(), current.version());
                if (change.name() != null) {
                    requireText(ontologyId, change.name(), "Concept name");
                }
                Concept updated = new Concept(current.id(), ontologyId,
                        change.name() != null ? change.name().trim() : current.name(),
                        change.category() != null ? change.category() : current.category(),
                        change.color() != null ? change.color() : current.color(),
                        change.definition() != null ? change.definition() : current.definition(),
                        change.position() != null ? change.position() : current.position(),
                        current.version() + 1);
                tx.putConcept(updated);
                return updated;
            }
            case DELETED: {
                Concept current = requireConcept(tx, change.conceptId());
                checkVersion(ontologyId, "Concept", current.id(), change.expectedVersion(), current.version());
                deleteConcept(tx, current);
                return current;
            }
            default:
                throw new IllegalArgumentException("Unsupported change type " + change.changeType());
        }
    }

    public static Relationship applyRelationshipChange(GraphTransaction tx, RelationshipChange change) {
        Objects.requireNonNull(change.changeType(), "changeType");
        long ontologyId = tx.ontologyId();
        switch (change.changeType()) {
            case ADDED: {
                requireText(ontologyId, change.relationType(), "Relationship type");
                long source = requireEndpoint(tx, change.sourceConceptId(), "source");
                long target = requireEndpoint(tx, change.targetConceptId(), "target");
                long id = tx.allocateRelationshipId(change.relationshipId());
                Relationship created = new Relationship(id, ontologyId, source, target, change.relationType(), 1L);
                tx.putRelationship(created);
                return created;
            }
            case UPDATED: {
                Relationship current = requireRelationship(tx, change.relationshipId());
                checkVersion(ontologyId, "Relationship", current.id(), change.expectedVersion(), current.version());
                if (change.relationType() != null) {
                    requireText(ontologyId, change.relationType(), "Relationship type");
                }
                long source = change.sourceConceptId() != null
                        ? requireEndpoint(tx, change.sourceConceptId(), "source") : current.sourceConceptId();
                long target = change.targetConceptId() != null
                        ? requireEndpoint(tx, change.targetConceptId(), "target") : current.targetConceptId();
                Relationship updated = new Relationship(current.id(), ontologyId, source, target,
                        change.relationType() != null ? change.relationType() : current.relationType(),
                        current.version() + 1);
                tx.putRelationship(updated);
                pruneStaleRecords(tx, updated);
                return updated;
            }
            case DELETED: {
                Relationship current = requireRelationship(tx, change.relationshipId());
                checkVersion(ontologyId, "Relationship", current.id(), change.expectedVersion(), current.version());
                tx.removeRelationship(current.id());
                pruneDeletedRecords(tx, Set.of(current.id()));
                return current;
            }
            default:
                throw new IllegalArgumentException("Unsupported change type " + change.changeType());
        }
    }

    public static Individual applyIndividualChange(GraphTransaction tx, IndividualChange change) {
        Objects.requireNonNull(change.changeType(), "changeType");
        long ontologyId = tx.ontologyId();
        switch (change.changeType()) {
            case ADDED: {
                requireText(ontologyId, change.name(), "Individual name");
                long conceptType = requireConceptType(tx, change.conceptTypeId());
                long id = tx.allocateIndividualId(change.individualId());
                Individual created = new Individual(id, ontologyId, conceptType, change.name().trim(),
                        change.position(), 1L);
                tx.putIndividual(created);
                return created;
            }
            case UPDATED: {
                Individual current = requireIndividual(tx, change.individualId());
                checkVersion(ontologyId, "Individual", current.id(), change.expectedVersion(), current.version());
                if (change.name() != null) {
                    requireText(ontologyId, change.name(), "Individual name");
                }
                Individual updated = new Individual(current.id(), ontologyId,
                        change.conceptTypeId() != null ? requireConceptType(tx, change.conceptTypeId())
                                : current.conceptTypeId(),
                        change.name() != null ? change.name().trim() : current.name(),
                        change.position() != null ? change.position() : current.position(),
                        current.version() + 1);
                tx.putIndividual(updated);
                return updated;
            }
            case DELETED: {
                Individual current = requireIndividual(tx, change.individualId());
                checkVersion(ontologyId, "Individual", current.id(), change.expectedVersion(), current.version());
                for (IndividualRelationship link : tx.individualRelationships()) {
                    if (link.touches(current.id())) {
                        tx.removeIndividualRelationship(link.id());
                    }
                }
                tx.removeIndividual(current.id());
                return current;
            }
            default:
                throw new IllegalArgumentException("Unsupported change type " + change.changeType());
        }
    }

    public static IndividualRelationship applyIndividualRelationshipChange(GraphTransaction tx,
                                                                           IndividualRelationshipChange change) {
        Objects.requireNonNull(change.changeType(), "changeType");
        long ontologyId = tx.ontologyId();
        switch (change.changeType()) {
            case ADDED: {
                requireText(ontologyId, change.relationType(), "Relationship type");
                long source = requireIndividualEndpoint(tx, change.sourceIndividualId(), "source");
                long target = requireIndividualEndpoint(tx, change.targetIndividualId(), "target");
                long id = tx.allocateIndividualRelationshipId(change.individualRelationshipId());
                IndividualRelationship created = new IndividualRelationship(id, ontologyId, source, target,
                        change.relationType(), 1L);
                tx.putIndividualRelationship(created);
                return created;
            }
            case UPDATED: {
                IndividualRelationship current = requireIndividualRelationship(tx, change.individualRelationshipId());
                checkVersion(ontologyId, "IndividualRelationship", current.id(), change.expectedVersion(),
                        current.version());
                if (change.relationType() != null) {
                    requireText(ontologyId, change.relationType(), "Relationship type");
                }
                IndividualRelationship updated = new IndividualRelationship(current.id(), ontologyId,
                        change.sourceIndividualId() != null
                                ? requireIndividualEndpoint(tx, change.sourceIndividualId(), "source")
                                : current.sourceIndividualId(),
                        change.targetIndividualId() != null
                                ? requireIndividualEndpoint(tx, change.targetIndividualId(), "target")
                                : current.targetIndividualId(),
                        change.relationType() != null ? change.relationType() : current.relationType(),
                        current.version() + 1);
                tx.putIndividualRelationship(updated);
                return updated;
            }
            case DELETED: {
                IndividualRelationship current = requireIndividualRelationship(tx, change.individualRelationshipId());
                checkVersion(ontologyId, "IndividualRelationship", current.id(), change.expectedVersion(),
                        current.version());
                tx.removeIndividualRelationship(current.id());
                return current;
            }
            default:
                throw new IllegalArgumentException("Unsupported change type " + change.changeType());
        }
    }

    /**
     * Removes a concept together with its relationships and its group memberships. Groups the
     * concept represents are deleted; groups left without children are deleted.
     */
    private static void deleteConcept(GraphTransaction tx, Concept concept) {
        long conceptId = concept.id();
        List<Long> typedIndividuals = tx.individuals().stream()
                .filter(i -> i.conceptTypeId() == conceptId)
                .map(Individual::id)
                .collect(Collectors.toList());
        if (!typedIndividuals.isEmpty()) {
            throw GraphSyncException.conflict(tx.ontologyId(),
                    String.format("Concept %d is the type of individuals %s", conceptId, typedIndividuals));
        }

        Set<Long> removedRelationships = new LinkedHashSet<>();
        for (Relationship relationship : tx.relationships()) {
            if (relationship.touches(conceptId)) {
                tx.removeRelationship(relationship.id());
                removedRelationships.add(relationship.id());
            }
        }

        for (ConceptGroup group : tx.groups()) {
            if (group.parentConceptId() == conceptId) {
                LOG.debugf("Deleting group %d of ontology %d with its parent concept %d",
                        group.id(), tx.ontologyId(), conceptId);
                tx.removeGroup(group.id());
            } else if (group.containsChild(conceptId)) {
                Set<Long> children = new LinkedHashSet<>(group.childConceptIds());
                children.remove(conceptId);
                if (children.isEmpty()) {
                    LOG.debugf("Deleting group %d of ontology %d, its last child %d was deleted",
                            group.id(), tx.ontologyId(), conceptId);
                    tx.removeGroup(group.id());
                } else {
                    tx.putGroup(new ConceptGroup(group.id(), group.ontologyId(), group.createdBy(),
                            group.parentConceptId(), children, group.collapsed(), group.groupName(),
                            group.collapsedRelationships(), group.version() + 1));
                }
            }
        }
        tx.removeConcept(conceptId);
        pruneDeletedRecords(tx, removedRelationships);
    }

    /**
     * Drops collapse records of relationships that no longer exist.
     */
    static void pruneDeletedRecords(GraphTransaction tx, Set<Long> removedRelationshipIds) {
        if (removedRelationshipIds.isEmpty()) {
            return;
        }
        for (ConceptGroup group : tx.groups()) {
            List<CollapsedRelationship> kept = group.collapsedRelationships().stream()
                    .filter(r -> !removedRelationshipIds.contains(r.relationshipId()))
                    .collect(Collectors.toList());
            if (kept.size() != group.collapsedRelationships().size()) {
                tx.putGroup(group.withCollapsed(group.collapsed(), kept));
            }
        }
    }

    /**
     * Drops collapse records an updated relationship no longer matches, e.g. after it was re-pointed
     * away from the grouped concepts.
     */
    static void pruneStaleRecords(GraphTransaction tx, Relationship updated) {
        for (ConceptGroup group : tx.groups()) {
            Set<Long> grouped = group.groupedConceptIds();
            List<CollapsedRelationship> kept = group.collapsedRelationships().stream()
                    .filter(r -> r.relationshipId() != updated.id() || r.matches(updated, grouped))
                    .collect(Collectors.toList());
            if (kept.size() != group.collapsedRelationships().size()) {
                LOG.infof("Dropped collapse record of relationship %d from group %d, its endpoints changed",
                        updated.id(), group.id());
                tx.putGroup(group.withCollapsed(group.collapsed(), kept));
            }
        }
    }

    static void checkVersion(long ontologyId, String kind, long id, Long expected, long actual) {
        if (expected != null && expected != actual) {
            throw GraphSyncException.stale(ontologyId, kind, id, expected, actual);
        }
    }

    private static void requireText(long ontologyId, String value, String field) {
        if (value == null || value.isBlank()) {
            throw GraphSyncException.invalidRequest(ontologyId, field + " is required");
        }
    }

    private static long requireId(long ontologyId, Long id, String kind) {
        if (id == null) {
            throw GraphSyncException.invalidRequest(ontologyId, kind + " id is required");
        }
        return id;
    }

    private static Concept requireConcept(GraphTransaction tx, Long conceptId) {
        long id = requireId(tx.ontologyId(), conceptId, "Concept");
        return tx.findConcept(id).orElseThrow(() -> GraphSyncException.notFound(tx.ontologyId(), "Concept", id));
    }

    private static Relationship requireRelationship(GraphTransaction tx, Long relationshipId) {
        long id = requireId(tx.ontologyId(), relationshipId, "Relationship");
        return tx.findRelationship(id)
                .orElseThrow(() -> GraphSyncException.notFound(tx.ontologyId(), "Relationship", id));
    }

    private static Individual requireIndividual(GraphTransaction tx, Long individualId) {
        long id = requireId(tx.ontologyId(), individualId, "Individual");
        return tx.findIndividual(id)
                .orElseThrow(() -> GraphSyncException.notFound(tx.ontologyId(), "Individual", id));
    }

    private static IndividualRelationship requireIndividualRelationship(GraphTransaction tx, Long id) {
        long linkId = requireId(tx.ontologyId(), id, "IndividualRelationship");
        return tx.findIndividualRelationship(linkId)
                .orElseThrow(() -> GraphSyncException.notFound(tx.ontologyId(), "IndividualRelationship", linkId));
    }

    private static long requireEndpoint(GraphTransaction tx, Long conceptId, String end) {
        long id = requireId(tx.ontologyId(), conceptId, "Relationship " + end);
        if (!tx.hasConcept(id)) {
            throw GraphSyncException.invalidReference(tx.ontologyId(),
                    String.format("Relationship %s concept %d does not exist in ontology %d", end, id, tx.ontologyId()));
        }
        return id;
    }

    private static long requireConceptType(GraphTransaction tx, Long conceptTypeId) {
        long id = requireId(tx.ontologyId(), conceptTypeId, "Concept type");
        if (!tx.hasConcept(id)) {
            throw GraphSyncException.invalidReference(tx.ontologyId(),
                    String.format("Concept type %d does not exist in ontology %d", id, tx.ontologyId()));
        }
        return id;
    }

    private static long requireIndividualEndpoint(GraphTransaction tx, Long individualId, String end) {
        long id = requireId(tx.ontologyId(), individualId, "Individual relationship " + end);
        if (!tx.hasIndividual(id)) {
            throw GraphSyncException.invalidReference(tx.ontologyId(),
                    String.format("Individual relationship %s %d does not exist in ontology %d", end, id,
                            tx.ontologyId()));
        }
        return id;
    }
}
