package com.eidos.collab.graph.mongo;

import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.mongo.model.ConceptDocument;
import com.eidos.collab.graph.mongo.model.ConceptGroupDocument;
import com.eidos.collab.graph.mongo.model.IndividualDocument;
import com.eidos.collab.graph.mongo.model.IndividualRelationshipDocument;
import com.eidos.collab.graph.mongo.model.OntologyGraphMetaDocument;
import com.eidos.collab.graph.mongo.model.RelationshipDocument;
import com.eidos.collab.graph.persistence.GraphStateRepository;
import com.eidos.collab.graph.store.GraphDelta;
import com.eidos.collab.graph.store.GraphSnapshot;
import com.mongodb.client.MongoClient;
import dev.morphia.Datastore;
import dev.morphia.DeleteOptions;
import dev.morphia.Morphia;
import dev.morphia.query.filters.Filters;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * Stores ontology graphs in MongoDB, one collection per entity kind.
 * <p>
 * A delta is applied as deletions first, then upserts by document id, then the meta document
 * carrying the revision. A delta that fails part way leaves the stored graph behind the store;
 * {@link #replace(GraphSnapshot)} rewrites it from a complete snapshot.
 * </p>
 */
public class MorphiaGraphStateRepository implements GraphStateRepository {
    private static final Logger LOG = Logger.getLogger(MorphiaGraphStateRepository.class);

    private final Datastore datastore;

    public MorphiaGraphStateRepository(MongoClient mongoClient, String database) {
        this(Morphia.createDatastore(mongoClient, database));
    }

    public MorphiaGraphStateRepository(Datastore datastore) {
        this.datastore = datastore;
        datastore.getMapper().map(ConceptDocument.class, RelationshipDocument.class, IndividualDocument.class,
                IndividualRelationshipDocument.class, ConceptGroupDocument.class, OntologyGraphMetaDocument.class);
        datastore.ensureIndexes();
    }

    @Override
    public Optional<GraphSnapshot> load(long ontologyId) {
        OntologyGraphMetaDocument meta = datastore.find(OntologyGraphMetaDocument.class)
                .filter(Filters.eq("_id", ontologyId))
                .first();
        if (meta == null) {
            return Optional.empty();
        }
        Map<Long, Concept> concepts = byId(find(ConceptDocument.class, ontologyId), GraphDocumentMapper::toModel,
                Concept::id);
        Map<Long, Relationship> relationships = byId(find(RelationshipDocument.class, ontologyId),
                GraphDocumentMapper::toModel, Relationship::id);
        Map<Long, Individual> individuals = byId(find(IndividualDocument.class, ontologyId),
                GraphDocumentMapper::toModel, Individual::id);
        Map<Long, IndividualRelationship> links = byId(find(IndividualRelationshipDocument.class, ontologyId),
                GraphDocumentMapper::toModel, IndividualRelationship::id);
        Map<Long, ConceptGroup> groups = byId(find(ConceptGroupDocument.class, ontologyId),
                GraphDocumentMapper::toModel, ConceptGroup::id);
        LOG.debugf("Loaded ontology %d at revision %d: %d concepts, %d relationships, %d groups",
                ontologyId, meta.getRevision(), concepts.size(), relationships.size(), groups.size());
        return Optional.of(new GraphSnapshot(ontologyId, meta.getRevision(), meta.getNextId(), concepts,
                relationships, individuals, links, groups));
    }

    @Override
    public void apply(GraphDelta delta) {
        long ontologyId = delta.ontologyId();
        delete(ConceptGroupDocument.class, ontologyId, delta.deletedGroupIds());
        delete(IndividualRelationshipDocument.class, ontologyId, delta.deletedIndividualRelationshipIds());
        delete(IndividualDocument.class, ontologyId, delta.deletedIndividualIds());
        delete(RelationshipDocument.class, ontologyId, delta.deletedRelationshipIds());
        delete(ConceptDocument.class, ontologyId, delta.deletedConceptIds());

        save(delta.concepts().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));
        save(delta.relationships().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));
        save(delta.individuals().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));
        save(delta.individualRelationships().stream().map(GraphDocumentMapper::toDocument)
                .collect(Collectors.toList()));
        save(delta.groups().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));

        saveMeta(ontologyId, delta.revision(), delta.nextId());
        LOG.debugf("Persisted revision %d of ontology %d", delta.revision(), ontologyId);
    }

    /**
     * Deletes every entity document of the ontology, then saves the snapshot's entities and meta
     * document.
     */
    @Override
    public void replace(GraphSnapshot snapshot) {
        long ontologyId = snapshot.ontologyId();
        deleteEntities(ontologyId);
        save(snapshot.concepts().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));
        save(snapshot.relationships().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));
        save(snapshot.individuals().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));
        save(snapshot.individualRelationships().stream().map(GraphDocumentMapper::toDocument)
                .collect(Collectors.toList()));
        save(snapshot.groups().stream().map(GraphDocumentMapper::toDocument).collect(Collectors.toList()));
        saveMeta(ontologyId, snapshot.revision(), snapshot.nextId());
        LOG.infof("Rewrote ontology %d at revision %d", ontologyId, snapshot.revision());
    }

    /**
     * Removes every document of an ontology.
     */
    public void deleteOntology(long ontologyId) {
        deleteEntities(ontologyId);
        datastore.find(OntologyGraphMetaDocument.class)
                .filter(Filters.eq("_id", ontologyId))
                .delete();
        LOG.infof("Deleted persisted graph of ontology %d", ontologyId);
    }

    private void deleteEntities(long ontologyId) {
        for (Class<?> type : List.of(ConceptDocument.class, RelationshipDocument.class, IndividualDocument.class,
                IndividualRelationshipDocument.class, ConceptGroupDocument.class)) {
            datastore.find(type)
                    .filter(Filters.eq("ontologyId", ontologyId))
                    .delete(new DeleteOptions().multi(true));
        }
    }

    private void saveMeta(long ontologyId, long revision, long nextId) {
        OntologyGraphMetaDocument meta = new OntologyGraphMetaDocument();
        meta.setOntologyId(ontologyId);
        meta.setRevision(revision);
        meta.setNextId(nextId);
        meta.setUpdatedAt(new Date());
        datastore.save(meta);
    }

    private <D> List<D> find(Class<D> type, long ontologyId) {
        return datastore.find(type)
                .filter(Filters.eq("ontologyId", ontologyId))
                .iterator()
                .toList();
    }

    private <D> void save(List<D> documents) {
        if (!documents.isEmpty()) {
            datastore.save(documents);
        }
    }

    private void delete(Class<?> type, long ontologyId, Collection<Long> entityIds) {
        if (entityIds.isEmpty()) {
            return;
        }
        List<String> ids = entityIds.stream()
                .map(id -> GraphDocumentMapper.documentId(ontologyId, id))
                .collect(Collectors.toList());
        datastore.find(type)
                .filter(Filters.in("_id", ids))
                .delete(new DeleteOptions().multi(true));
    }

    private static <D, T> Map<Long, T> byId(List<D> documents, Function<D, T> toModel, ToLongFunction<T> id) {
        Map<Long, T> result = new TreeMap<>();
        for (D document : documents) {
            T model = toModel.apply(document);
            result.put(id.applyAsLong(model), model);
        }
        return result;
    }
}
