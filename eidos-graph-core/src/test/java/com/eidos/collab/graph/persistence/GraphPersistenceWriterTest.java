package com.eidos.collab.graph.persistence;

import com.eidos.collab.graph.GraphFixtures;
import com.eidos.collab.graph.grouping.ExpansionResult;
import com.eidos.collab.graph.grouping.GroupChange;
import com.eidos.collab.graph.grouping.GroupingEngine;
import com.eidos.collab.graph.grouping.GroupingSettings;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Position;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.store.ConceptChange;
import com.eidos.collab.graph.store.GraphDelta;
import com.eidos.collab.graph.store.GraphSnapshot;
import com.eidos.collab.graph.store.GraphStoreRegistry;
import com.eidos.collab.graph.store.OntologyGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.eidos.collab.graph.GraphFixtures.ONTOLOGY;
import static com.eidos.collab.graph.GraphFixtures.concepts;
import static com.eidos.collab.graph.GraphFixtures.relate;
import static org.junit.jupiter.api.Assertions.*;

class GraphPersistenceWriterTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static GraphStoreRegistry registry(GraphPersistenceWriter writer) {
        return new GraphStoreRegistry(writer, new GroupingEngine(GroupingSettings.defaults()), Duration.ofSeconds(1));
    }

    @Test
    void testDeltasReachRepositoryInCommitOrder() throws Exception {
        List<Long> applied = Collections.synchronizedList(new ArrayList<>());
        GraphStateRepository recording = new GraphStateRepository() {
            @Override
            public Optional<GraphSnapshot> load(long ontologyId) {
                return Optional.empty();
            }

            @Override
            public void apply(GraphDelta delta) {
                applied.add(delta.revision());
            }

            @Override
            public void replace(GraphSnapshot snapshot) {
                fail("no write failed, nothing to rewrite");
            }
        };
        GraphPersistenceWriter writer = new GraphPersistenceWriter(recording, executor);
        OntologyGraphStore store = registry(writer).store(ONTOLOGY);

        for (long id = 1; id <= 50; id++) {
            concepts(store, id);
        }
        writer.flush(ONTOLOGY).get(5, TimeUnit.SECONDS);

        assertEquals(50, applied.size());
        for (int i = 0; i < applied.size(); i++) {
            assertEquals(i + 1L, applied.get(i));
        }
        assertEquals(50, writer.getWrittenCount());
    }

    /**
     * Repository backed by memory whose delta writes fail for the given revisions.
     */
    private static GraphStateRepository failingAt(InMemoryGraphStateRepository memory, List<Long> replaced,
                                                  long... failingRevisions) {
        return new GraphStateRepository() {
            @Override
            public Optional<GraphSnapshot> load(long ontologyId) {
                return memory.load(ontologyId);
            }

            @Override
            public void apply(GraphDelta delta) {
                for (long revision : failingRevisions) {
                    if (delta.revision() == revision) {
                        throw new IllegalStateException("connection reset");
                    }
                }
                memory.apply(delta);
            }

            @Override
            public void replace(GraphSnapshot snapshot) {
                replaced.add(snapshot.revision());
                memory.replace(snapshot);
            }
        };
    }

    @Test
    void testFailedWriteIsCountedAndChainContinues() throws Exception {
        InMemoryGraphStateRepository memory = new InMemoryGraphStateRepository();
        List<Long> replaced = Collections.synchronizedList(new ArrayList<>());
        GraphPersistenceWriter writer = new GraphPersistenceWriter(failingAt(memory, replaced, 2), executor);
        OntologyGraphStore store = registry(writer).store(ONTOLOGY);

        concepts(store, 1, 2, 3);
        writer.flushAll().get(5, TimeUnit.SECONDS);

        assertEquals(1, writer.getFailureCount());
        assertEquals(2, writer.getWrittenCount());
        assertEquals(3, store.snapshot().concepts().size(), "in-memory state is unaffected");
        assertEquals(List.of(3L), replaced, "the write after the failure stores the full state");
        assertFalse(writer.isOutOfSync(ONTOLOGY));
        assertEquals(3, memory.load(ONTOLOGY).orElseThrow().revision());
        assertEquals(3, memory.load(ONTOLOGY).orElseThrow().concepts().size());
    }

    @Test
    void testReloadAfterFailedWriteHasNoDanglingRelationships() throws Exception {
        InMemoryGraphStateRepository memory = new InMemoryGraphStateRepository();
        List<Long> replaced = Collections.synchronizedList(new ArrayList<>());
        GraphPersistenceWriter writer = new GraphPersistenceWriter(failingAt(memory, replaced, 2), executor);
        OntologyGraphStore store = registry(writer).store(ONTOLOGY);

        concepts(store, 1, 2);
        relate(store, 10, 1, 2, "eats");
        writer.flush(ONTOLOGY).get(5, TimeUnit.SECONDS);

        OntologyGraphStore reloaded = registry(new GraphPersistenceWriter(memory, executor)).store(ONTOLOGY);
        GraphSnapshot state = reloaded.snapshot();
        assertEquals(store.snapshot().revision(), state.revision());
        assertEquals(2, state.concepts().size());
        for (Relationship relationship : state.relationships()) {
            assertTrue(state.findConcept(relationship.sourceConceptId()).isPresent(),
                    "source of relationship " + relationship.id());
            assertTrue(state.findConcept(relationship.targetConceptId()).isPresent(),
                    "target of relationship " + relationship.id());
        }
    }

    @Test
    void testOntologyStaysOutOfSyncUntilNextWriteSucceeds() throws Exception {
        InMemoryGraphStateRepository memory = new InMemoryGraphStateRepository();
        List<Long> replaced = Collections.synchronizedList(new ArrayList<>());
        GraphPersistenceWriter writer = new GraphPersistenceWriter(failingAt(memory, replaced, 2), executor);
        OntologyGraphStore store = registry(writer).store(ONTOLOGY);

        concepts(store, 1, 2);
        writer.flush(ONTOLOGY).get(5, TimeUnit.SECONDS);
        assertTrue(writer.isOutOfSync(ONTOLOGY));
        assertEquals(1, memory.load(ONTOLOGY).orElseThrow().revision());

        concepts(store, 3);
        writer.flush(ONTOLOGY).get(5, TimeUnit.SECONDS);
        assertFalse(writer.isOutOfSync(ONTOLOGY));
        assertEquals(List.of(3L), replaced);
        assertEquals(3, memory.load(ONTOLOGY).orElseThrow().concepts().size());
    }

    @Test
    void testEmptyDeltaIsSkipped() {
        GraphPersistenceWriter writer = new GraphPersistenceWriter(new InMemoryGraphStateRepository(), executor);
        writer.submit(GraphDelta.empty(ONTOLOGY, 4, 1), GraphSnapshot.empty(ONTOLOGY));
        assertTrue(writer.flush(ONTOLOGY).isDone());
        assertEquals(0, writer.getWrittenCount());
    }

    @Test
    void testReloadedStateKeepsCollapsedGroup() throws Exception {
        InMemoryGraphStateRepository repository = new InMemoryGraphStateRepository();
        GraphPersistenceWriter writer = new GraphPersistenceWriter(repository, executor);
        OntologyGraphStore store = registry(writer).store(ONTOLOGY);
        GraphFixtures.concept(store, 1, "Parent", new Position(100, 100));
        concepts(store, 2, 3);
        relate(store, 10, 1, 2, "has-part");
        relate(store, 11, 2, 3, "eats");
        ConceptGroup group = GraphFixtures.group(store, 1, 2L);
        writer.flush(ONTOLOGY).get(5, TimeUnit.SECONDS);

        GraphPersistenceWriter restartedWriter = new GraphPersistenceWriter(repository, executor);
        OntologyGraphStore reloaded = registry(restartedWriter).store(ONTOLOGY);

        assertEquals(store.snapshot().revision(), reloaded.snapshot().revision());
        ConceptGroup restored = reloaded.snapshot().findGroup(group.id()).orElseThrow();
        assertTrue(restored.collapsed());
        assertEquals(group.collapsedRelationships(), restored.collapsedRelationships());
        assertEquals(List.of(1L, 3L), reloaded.visibleGraph().conceptIds());

        ExpansionResult expansion = reloaded.applyGroupChange("alice", GroupChange.expand(group.id())).result().expansion();
        assertEquals(List.of(2L), expansion.revealedConceptIds());
        assertEquals(List.of(10L, 11L), expansion.restoredRelationshipIds());

        long nextConcept = reloaded.applyConceptChange(
                ConceptChange.create(null, "Fresh")).result().id();
        assertTrue(nextConcept > group.id(), "id allocation continues after reload");
    }
}
