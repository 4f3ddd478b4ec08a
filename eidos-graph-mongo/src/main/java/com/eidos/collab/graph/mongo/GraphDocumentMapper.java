package com.eidos.collab.graph.mongo;

import com.eidos.collab.graph.model.CollapsedRelationship;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Position;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.mongo.model.CollapsedRelationshipEntity;
import com.eidos.collab.graph.mongo.model.ConceptDocument;
import com.eidos.collab.graph.mongo.model.ConceptGroupDocument;
import com.eidos.collab.graph.mongo.model.IndividualDocument;
import com.eidos.collab.graph.mongo.model.IndividualRelationshipDocument;
import com.eidos.collab.graph.mongo.model.RelationshipDocument;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts between graph records and their Morphia documents.
 */
public final class GraphDocumentMapper {

    private GraphDocumentMapper() {
    }

    public static String documentId(long ontologyId, long entityId) {
        return ontologyId + ":" + entityId;
    }

    public static ConceptDocument toDocument(Concept concept) {
        ConceptDocument doc = new ConceptDocument();
        doc.setId(documentId(concept.ontologyId(), concept.id()));
        doc.setOntologyId(concept.ontologyId());
        doc.setConceptId(concept.id());
        doc.setName(concept.name());
        doc.setCategory(concept.category());
        doc.setColor(concept.color());
        doc.setDefinition(concept.definition());
        if (concept.position() != null) {
            doc.setX(concept.position().x());
            doc.setY(concept.position().y());
        }
        doc.setVersion(concept.version());
        return doc;
    }

    public static Concept toModel(ConceptDocument doc) {
        return new Concept(doc.getConceptId(), doc.getOntologyId(), doc.getName(), doc.getCategory(), doc.getColor(),
                doc.getDefinition(), position(doc.getX(), doc.getY()), doc.getVersion());
    }

    public static RelationshipDocument toDocument(Relationship relationship) {
        RelationshipDocument doc = new RelationshipDocument();
        doc.setId(documentId(relationship.ontologyId(), relationship.id()));
        doc.setOntologyId(relationship.ontologyId());
        doc.setRelationshipId(relationship.id());
        doc.setSourceConceptId(relationship.sourceConceptId());
        doc.setTargetConceptId(relationship.targetConceptId());
        doc.setRelationType(relationship.relationType());
        doc.setVersion(relationship.version());
        return doc;
    }

    public static Relationship toModel(RelationshipDocument doc) {
        return new Relationship(doc.getRelationshipId(), doc.getOntologyId(), doc.getSourceConceptId(),
                doc.getTargetConceptId(), doc.getRelationType(), doc.getVersion());
    }

    public static IndividualDocument toDocument(Individual individual) {
        IndividualDocument doc = new IndividualDocument();
        doc.setId(documentId(individual.ontologyId(), individual.id()));
        doc.setOntologyId(individual.ontologyId());
        doc.setIndividualId(individual.id());
        doc.setConceptTypeId(individual.conceptTypeId());
        doc.setName(individual.name());
        if (individual.position() != null) {
            doc.setX(individual.position().x());
            doc.setY(individual.position().y());
        }
        doc.setVersion(individual.version());
        return doc;
    }

    public static Individual toModel(IndividualDocument doc) {
        return new Individual(doc.getIndividualId(), doc.getOntologyId(), doc.getConceptTypeId(), doc.getName(),
                position(doc.getX(), doc.getY()), doc.getVersion());
    }

    public static IndividualRelationshipDocument toDocument(IndividualRelationship link) {
        IndividualRelationshipDocument doc = new IndividualRelationshipDocument();
        doc.setId(documentId(link.ontologyId(), link.id()));
        doc.setOntologyId(link.ontologyId());
        doc.setIndividualRelationshipId(link.id());
        doc.setSourceIndividualId(link.sourceIndividualId());
        doc.setTargetIndividualId(link.targetIndividualId());
        doc.setRelationType(link.relationType());
        doc.setVersion(link.version());
        return doc;
    }

    public static IndividualRelationship toModel(IndividualRelationshipDocument doc) {
        return new IndividualRelationship(doc.getIndividualRelationshipId(), doc.getOntologyId(),
                doc.getSourceIndividualId(), doc.getTargetIndividualId(), doc.getRelationType(), doc.getVersion());
    }

    public static ConceptGroupDocument toDocument(ConceptGroup group) {
        ConceptGroupDocument doc = new ConceptGroupDocument();
        doc.setId(documentId(group.ontologyId(), group.id()));
        doc.setOntologyId(group.ontologyId());
        doc.setGroupId(group.id());
        doc.setCreatedBy(group.createdBy());
        doc.setParentConceptId(group.parentConceptId());
        doc.setChildConceptIds(new ArrayList<>(group.childConceptIds()));
        doc.setCollapsed(group.collapsed());
        doc.setGroupName(group.groupName());
        doc.setCollapsedRelationships(group.collapsedRelationships().stream()
                .map(GraphDocumentMapper::toEntity)
                .collect(Collectors.toList()));
        doc.setVersion(group.version());
        return doc;
    }

    public static ConceptGroup toModel(ConceptGroupDocument doc) {
        List<CollapsedRelationship> records = doc.getCollapsedRelationships() == null
                ? List.of()
                : doc.getCollapsedRelationships().stream()
                        .map(GraphDocumentMapper::toModel)
                        .collect(Collectors.toList());
        return new ConceptGroup(doc.getGroupId(), doc.getOntologyId(), doc.getCreatedBy(), doc.getParentConceptId(),
                doc.getChildConceptIds() != null ? new LinkedHashSet<>(doc.getChildConceptIds()) : new LinkedHashSet<>(),
                doc.isCollapsed(), doc.getGroupName(), records, doc.getVersion());
    }

    static CollapsedRelationshipEntity toEntity(CollapsedRelationship record) {
        CollapsedRelationshipEntity entity = new CollapsedRelationshipEntity();
        entity.setRelationshipId(record.relationshipId());
        entity.setRelationType(record.relationType());
        entity.setSourceConceptId(record.sourceConceptId());
        entity.setTargetConceptId(record.targetConceptId());
        entity.setExternalConceptId(record.externalConceptId());
        entity.setFromGroupedChild(record.fromGroupedChild());
        entity.setToGroupedChild(record.toGroupedChild());
        entity.setShouldBeRerouted(record.shouldBeRerouted());
        return entity;
    }

    static CollapsedRelationship toModel(CollapsedRelationshipEntity entity) {
        return new CollapsedRelationship(entity.getRelationshipId(), entity.getRelationType(),
                entity.getSourceConceptId(), entity.getTargetConceptId(), entity.getExternalConceptId(),
                entity.isFromGroupedChild(), entity.isToGroupedChild(), entity.isShouldBeRerouted());
    }

    private static Position position(Double x, Double y) {
        return x != null && y != null ? new Position(x, y) : null;
    }
}
