package com.eidos.collab.graph.store;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupingEngine;
import com.eidos.collab.graph.grouping.GroupingSettings;
import com.eidos.collab.graph.persistence.GraphPersistenceWriter;
import com.eidos.collab.graph.persistence.InMemoryGraphStateRepository;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static com.eidos.collab.graph.GraphFixtures.ONTOLOGY;
import static com.eidos.collab.graph.GraphFixtures.concepts;
import static org.junit.jupiter.api.Assertions.*;

class GraphStoreRegistryTest {

    private static GraphStoreRegistry registry(GraphPersistenceWriter writer) {
        return new GraphStoreRegistry(writer, new GroupingEngine(GroupingSettings.defaults()), Duration.ofSeconds(1));
    }

    @Test
    void testReleasedStoreIsReloadedFromRepository() {
        InMemoryGraphStateRepository repository = new InMemoryGraphStateRepository();
        GraphStoreRegistry registry = registry(new GraphPersistenceWriter(repository, Runnable::run));
        OntologyGraphStore store = registry.store(ONTOLOGY);
        concepts(store, 1, 2);

        assertTrue(registry.release(ONTOLOGY).join());

        assertTrue(registry.openOntologies().isEmpty());
        assertTrue(store.isClosed());
        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyConceptChange(ConceptChange.create(3L, "Late")));
        assertEquals(ReasonCode.BUSY, ex.getReason());
        assertTrue(ex.isRetryable());

        OntologyGraphStore reopened = registry.store(ONTOLOGY);
        assertNotSame(store, reopened);
        assertEquals(Set.of(ONTOLOGY), registry.openOntologies());
        assertEquals(2, reopened.snapshot().revision());
        assertEquals(2, reopened.snapshot().concepts().size());
        assertEquals(3L, reopened.applyConceptChange(ConceptChange.create(null, "Next")).result().id());
    }

    @Test
    void testReleaseOfUnknownOntologyIsNoop() {
        GraphStoreRegistry registry = registry(
                new GraphPersistenceWriter(new InMemoryGraphStateRepository(), Runnable::run));

        assertFalse(registry.release(ONTOLOGY).join());
        assertTrue(registry.openOntologies().isEmpty());
    }

    @Test
    void testStoreBehindRepositoryIsKeptOpen() {
        InMemoryGraphStateRepository failing = new InMemoryGraphStateRepository() {
            @Override
            public void apply(GraphDelta delta) {
                throw new IllegalStateException("connection reset");
            }
        };
        GraphPersistenceWriter writer = new GraphPersistenceWriter(failing, Runnable::run);
        GraphStoreRegistry registry = registry(writer);
        OntologyGraphStore store = registry.store(ONTOLOGY);
        concepts(store, 1);
        assertTrue(writer.isOutOfSync(ONTOLOGY));

        assertFalse(registry.release(ONTOLOGY).join());

        assertFalse(store.isClosed());
        assertSame(store, registry.store(ONTOLOGY));
        concepts(store, 2);
        assertFalse(writer.isOutOfSync(ONTOLOGY));
        assertTrue(registry.release(ONTOLOGY).join());
        assertEquals(2, registry.store(ONTOLOGY).snapshot().concepts().size());
    }
}
