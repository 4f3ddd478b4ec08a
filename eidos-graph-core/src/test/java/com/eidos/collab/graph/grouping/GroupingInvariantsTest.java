package com.eidos.collab.graph.grouping;

import com.eidos.collab.graph.GraphFixtures;
import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.model.CollapsedRelationship;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.GraphEdge;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.store.ConceptChange;
import com.eidos.collab.graph.store.GraphSnapshot;
import com.eidos.collab.graph.store.OntologyGraphStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.eidos.collab.graph.GraphFixtures.concepts;
import static com.eidos.collab.graph.GraphFixtures.relate;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives random group operations and checks the structural rules after every step.
 */
class GroupingInvariantsTest {

    private static final int CONCEPTS = 14;

    @Test
    void testRandomOperationsKeepGroupsConsistent() {
        Random random = new Random(42);
        OntologyGraphStore store = GraphFixtures.newStore();
        for (long id = 1; id <= CONCEPTS; id++) {
            concepts(store, id);
        }
        long relationshipId = 100;
        for (int i = 0; i < 20; i++) {
            long source = 1 + random.nextInt(CONCEPTS);
            long target = 1 + random.nextInt(CONCEPTS);
            if (source != target) {
                relate(store, relationshipId++, source, target, "r" + (i % 3));
            }
        }

        int accepted = 0;
        int rejected = 0;
        for (int step = 0; step < 400; step++) {
            try {
                randomStep(store, random);
                accepted++;
            } catch (GraphSyncException e) {
                assertFalse(e.isRetryable(), "single-threaded steps never need a retry: " + e.getMessage());
                rejected++;
            }
            checkInvariants(store.snapshot(), store.getGrouping().getSettings().maxDepth());
        }
        assertTrue(accepted > 0);
        assertTrue(rejected > 0);
    }

    private static void randomStep(OntologyGraphStore store, Random random) {
        List<ConceptGroup> groups = new ArrayList<>(store.snapshot().groups());
        int roll = random.nextInt(10);
        if (roll < 4 || groups.isEmpty()) {
            long parent = 1 + random.nextInt(CONCEPTS);
            List<Long> children = new ArrayList<>();
            int count = 1 + random.nextInt(3);
            for (int i = 0; i < count; i++) {
                long child = 1 + random.nextInt(CONCEPTS);
                if (!children.contains(child)) {
                    children.add(child);
                }
            }
            store.applyGroupChange("alice", GroupChange.create(parent, children));
            return;
        }
        ConceptGroup group = groups.get(random.nextInt(groups.size()));
        switch (roll) {
            case 4:
            case 5:
                store.applyGroupChange("alice", GroupChange.expand(group.id()));
                break;
            case 6:
                store.applyGroupChange("alice", GroupChange.collapse(group.id()));
                break;
            case 7:
                store.applyGroupChange("alice", GroupChange.removeChildren(group.id(),
                        List.of(group.childConceptIds().iterator().next())));
                break;
            case 8:
                store.applyGroupChange("alice", GroupChange.delete(group.id()));
                break;
            default:
                long victim = 1 + random.nextInt(CONCEPTS);
                if (store.snapshot().hasConcept(victim)) {
                    store.applyConceptChange(ConceptChange.delete(victim));
                } else {
                    concepts(store, victim);
                }
                break;
        }
    }

    private static void checkInvariants(GraphSnapshot snapshot, int maxDepth) {
        Map<Long, Long> groupOfChild = new HashMap<>();
        Set<Long> parents = new HashSet<>();
        for (ConceptGroup group : snapshot.groups()) {
            assertFalse(group.childConceptIds().isEmpty(), "empty group " + group.id());
            assertFalse(group.childConceptIds().contains(group.parentConceptId()), "parent in own group");
            assertTrue(parents.add(group.parentConceptId()), "two groups share parent " + group.parentConceptId());
            assertTrue(snapshot.hasConcept(group.parentConceptId()), "dangling parent");
            for (Long child : group.childConceptIds()) {
                assertTrue(snapshot.hasConcept(child), "dangling child " + child);
                assertNull(groupOfChild.put(child, group.id()), "concept " + child + " in two groups");
            }
            for (CollapsedRelationship record : group.collapsedRelationships()) {
                Relationship relationship = snapshot.findRelationship(record.relationshipId()).orElse(null);
                assertNotNull(relationship, "record for deleted relationship " + record.relationshipId());
            }
        }

        Map<Long, Long> parentOfChild = new HashMap<>();
        for (ConceptGroup group : snapshot.groups()) {
            for (Long child : group.childConceptIds()) {
                parentOfChild.put(child, group.parentConceptId());
            }
        }
        for (Long concept : parentOfChild.keySet()) {
            int depth = 0;
            Set<Long> seen = new HashSet<>();
            Long current = concept;
            while (parentOfChild.containsKey(current)) {
                assertTrue(seen.add(current), "containment cycle through " + current);
                current = parentOfChild.get(current);
                depth++;
            }
            assertTrue(depth <= maxDepth, "depth " + depth + " exceeds " + maxDepth);
        }

        VisibleGraph visible = VisibleGraph.project(snapshot);
        for (Concept concept : snapshot.concepts()) {
            assertTrue(visible.isVisible(visible.representativeOf(concept.id())),
                    "representative of " + concept.id() + " is hidden");
        }
        assertEquals(snapshot.relationships().size(), visible.edgesOf(GraphEdge.Direct.class).size()
                + visible.edgesOf(GraphEdge.Internal.class).size()
                + visible.edgesOf(GraphEdge.Rerouted.class).size(), "every relationship projects to one edge");
    }
}
