package com.eidos.collab.graph.store;

import com.eidos.collab.graph.GraphFixtures;
import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupingEngine;
import com.eidos.collab.graph.grouping.GroupingSettings;
import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.CollapsedRelationship;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Relationship;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.eidos.collab.graph.GraphFixtures.concepts;
import static com.eidos.collab.graph.GraphFixtures.group;
import static com.eidos.collab.graph.GraphFixtures.relate;
import static org.junit.jupiter.api.Assertions.*;

class OntologyGraphStoreTest {

    @Test
    void testCreateAssignsIdAndVersion() {
        OntologyGraphStore store = GraphFixtures.newStore();
        GraphCommit<Concept> commit = store.applyConceptChange(ConceptChange.create(null, "Person"));

        assertTrue(commit.changed());
        assertEquals(1L, commit.revision());
        assertEquals(1L, commit.result().id());
        assertEquals(1L, commit.result().version());
        assertEquals(List.of(commit.result()), commit.delta().concepts());
        assertSame(commit.snapshot(), store.snapshot());
    }

    @Test
    void testProposedIdHonouredWhenFree() {
        OntologyGraphStore store = GraphFixtures.newStore();
        Concept created = store.applyConceptChange(ConceptChange.create(7L, "Person")).result();
        assertEquals(7L, created.id());

        Concept next = store.applyConceptChange(ConceptChange.create(null, "Place")).result();
        assertEquals(8L, next.id());

        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyConceptChange(ConceptChange.create(7L, "Duplicate")));
        assertEquals(ReasonCode.CONFLICT, ex.getReason());
    }

    @Test
    void testUpdateChecksVersion() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1);

        Concept renamed = store.applyConceptChange(ConceptChange.rename(1, "Renamed", 1L)).result();
        assertEquals("Renamed", renamed.name());
        assertEquals(2L, renamed.version());

        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyConceptChange(ConceptChange.rename(1, "Again", 1L)));
        assertEquals(ReasonCode.STALE_STATE, ex.getReason());
        assertTrue(ex.isRetryable());
        assertEquals("Renamed", store.snapshot().findConcept(1).orElseThrow().name());
    }

    @Test
    void testUnknownEntityIsNotFound() {
        OntologyGraphStore store = GraphFixtures.newStore();
        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyConceptChange(ConceptChange.rename(42, "Nobody", null)));
        assertEquals(ReasonCode.NOT_FOUND, ex.getReason());
    }

    @Test
    void testRelationshipEndpointsMustExist() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1);

        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyRelationshipChange(RelationshipChange.create(null, 1, 2, "part-of")));
        assertEquals(ReasonCode.INVALID_REFERENCE, ex.getReason());
        assertTrue(store.snapshot().relationships().isEmpty());
    }

    @Test
    void testBlankNameIsInvalidRequest() {
        OntologyGraphStore store = GraphFixtures.newStore();
        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyConceptChange(ConceptChange.create(null, "  ")));
        assertEquals(ReasonCode.INVALID_REQUEST, ex.getReason());
    }

    @Test
    void testNonPositiveProposedIdIsInvalidRequest() {
        OntologyGraphStore store = GraphFixtures.newStore();
        for (long proposed : new long[] {0L, -1L}) {
            GraphSyncException ex = assertThrows(GraphSyncException.class,
                    () -> store.applyConceptChange(ConceptChange.create(proposed, "Person")));
            assertEquals(ReasonCode.INVALID_REQUEST, ex.getReason());
            assertFalse(ex.isRetryable());
        }
        assertTrue(store.snapshot().concepts().isEmpty());
        assertEquals(0L, store.snapshot().revision());
    }

    @Test
    void testFailedWorkPublishesNothing() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1);
        GraphSnapshot before = store.snapshot();

        assertThrows(GraphSyncException.class, () -> store.write(tx -> {
            GraphMutations.applyConceptChange(tx, ConceptChange.create(2L, "Kept?"));
            return GraphMutations.applyConceptChange(tx, ConceptChange.create(1L, "Duplicate"));
        }));

        assertSame(before, store.snapshot());
        assertFalse(store.snapshot().hasConcept(2));
    }

    @Test
    void testWriteWithoutChangesKeepsRevision() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1);
        List<Boolean> callbacks = new ArrayList<>();

        GraphCommit<String> commit = store.write(tx -> "read only", c -> callbacks.add(c.changed()));

        assertFalse(commit.changed());
        assertEquals(1L, commit.revision());
        assertTrue(commit.delta().isEmpty());
        assertEquals(List.of(false), callbacks);
    }

    @Test
    void testSnapshotsAreImmutable() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1, 2);
        relate(store, 10, 1, 2, "part-of");
        group(store, 1, 2L);
        GraphSnapshot snapshot = store.snapshot();

        assertThrows(UnsupportedOperationException.class, () -> snapshot.concepts().clear());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.relationships().clear());
        ConceptGroup group = snapshot.groups().iterator().next();
        assertThrows(UnsupportedOperationException.class, () -> group.childConceptIds().add(3L));
        assertThrows(UnsupportedOperationException.class, () -> group.collapsedRelationships().clear());
    }

    @Test
    void testDeleteConceptCascades() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1, 2, 3, 4);
        relate(store, 10, 1, 2, "part-of");
        relate(store, 11, 3, 4, "related-to");
        relate(store, 12, 2, 3, "related-to");
        ConceptGroup byParent = group(store, 1, 2L);
        ConceptGroup single = group(store, 3, 4L);

        GraphCommit<Concept> deleted = store.applyConceptChange(ConceptChange.delete(4));

        GraphSnapshot after = deleted.snapshot();
        assertFalse(after.hasConcept(4));
        assertTrue(after.findRelationship(11).isEmpty());
        assertTrue(after.findGroup(single.id()).isEmpty(), "group left without children is deleted");
        assertEquals(Set.of(4L), deleted.delta().deletedConceptIds());
        assertEquals(Set.of(11L), deleted.delta().deletedRelationshipIds());
        assertEquals(Set.of(single.id()), deleted.delta().deletedGroupIds());

        store.applyConceptChange(ConceptChange.delete(1));
        GraphSnapshot last = store.snapshot();
        assertTrue(last.findGroup(byParent.id()).isEmpty(), "group is deleted with its parent");
        assertTrue(last.findRelationship(10).isEmpty());
        assertTrue(last.findRelationship(12).isPresent());
    }

    @Test
    void testDeleteChildKeepsGroupAndPrunesRecords() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1, 2, 3, 4);
        relate(store, 10, 1, 2, "part-of");
        relate(store, 11, 3, 4, "related-to");
        ConceptGroup created = group(store, 1, 2L, 3L);
        assertEquals(2, created.collapsedRelationships().size());

        store.applyConceptChange(ConceptChange.delete(3));

        ConceptGroup group = store.snapshot().findGroup(created.id()).orElseThrow();
        assertEquals(Set.of(2L), group.childConceptIds());
        assertEquals(List.of(10L), group.collapsedRelationships().stream()
                .map(CollapsedRelationship::relationshipId).collect(Collectors.toList()));
    }

    @Test
    void testDeleteRelationshipPrunesRecords() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1, 2, 3);
        relate(store, 10, 1, 2, "part-of");
        relate(store, 11, 2, 3, "related-to");
        ConceptGroup created = group(store, 1, 2L);

        store.applyRelationshipChange(RelationshipChange.delete(11));

        ConceptGroup group = store.snapshot().findGroup(created.id()).orElseThrow();
        assertEquals(1, group.collapsedRelationships().size());
        for (CollapsedRelationship record : group.collapsedRelationships()) {
            assertTrue(store.snapshot().findRelationship(record.relationshipId()).isPresent());
        }
    }

    @Test
    void testConceptWithIndividualsCannotBeDeleted() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1);
        store.applyIndividualChange(IndividualChange.create(5L, 1, "Alice"));

        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyConceptChange(ConceptChange.delete(1)));
        assertEquals(ReasonCode.CONFLICT, ex.getReason());
        assertTrue(store.snapshot().hasConcept(1));
    }

    @Test
    void testDeleteIndividualRemovesItsRelationships() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1);
        store.applyIndividualChange(IndividualChange.create(5L, 1, "Alice"));
        store.applyIndividualChange(IndividualChange.create(6L, 1, "Bob"));
        store.applyIndividualRelationshipChange(IndividualRelationshipChange.create(7L, 5, 6, "knows"));

        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyIndividualRelationshipChange(IndividualRelationshipChange.create(null, 5, 99, "knows")));
        assertEquals(ReasonCode.INVALID_REFERENCE, ex.getReason());

        store.applyIndividualChange(IndividualChange.delete(6));
        assertTrue(store.snapshot().findIndividualRelationship(7).isEmpty());
        assertTrue(store.snapshot().hasIndividual(5));
    }

    @Test
    void testRelationshipCanBeRepointed() {
        OntologyGraphStore store = GraphFixtures.newStore();
        concepts(store, 1, 2, 3);
        relate(store, 10, 1, 2, "part-of");

        Relationship moved = store.applyRelationshipChange(
                new RelationshipChange(ChangeType.UPDATED, 10L, null, 3L, null, 1L, null)).result();

        assertEquals(1L, moved.sourceConceptId());
        assertEquals(3L, moved.targetConceptId());
        assertEquals("part-of", moved.relationType());
        assertEquals(2L, moved.version());
    }

    @Test
    void testWriteFailsBusyWhenLockIsHeld() throws Exception {
        OntologyGraphStore store = new OntologyGraphStore(GraphSnapshot.empty(GraphFixtures.ONTOLOGY),
                Duration.ofMillis(50), new GroupingEngine(GroupingSettings.defaults()), null);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> store.write(tx -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        holder.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        GraphSyncException ex = assertThrows(GraphSyncException.class,
                () -> store.applyConceptChange(ConceptChange.create(null, "Blocked")));
        assertEquals(ReasonCode.BUSY, ex.getReason());
        assertTrue(ex.isRetryable());

        release.countDown();
        holder.join(5000);
        assertEquals(1L, store.applyConceptChange(ConceptChange.create(null, "Later")).revision());
    }
}
