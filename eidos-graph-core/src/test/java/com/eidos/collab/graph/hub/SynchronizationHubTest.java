package com.eidos.collab.graph.hub;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupChange;
import com.eidos.collab.graph.grouping.GroupingEngine;
import com.eidos.collab.graph.hub.event.ConceptChanged;
import com.eidos.collab.graph.hub.event.GroupChanged;
import com.eidos.collab.graph.hub.event.HubEvent;
import com.eidos.collab.graph.hub.event.LeaveReason;
import com.eidos.collab.graph.hub.event.MutationEvent;
import com.eidos.collab.graph.hub.event.PresenceList;
import com.eidos.collab.graph.hub.event.UserJoined;
import com.eidos.collab.graph.hub.event.UserLeft;
import com.eidos.collab.graph.hub.event.UserViewChanged;
import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.permission.InMemoryPermissionGate;
import com.eidos.collab.graph.permission.OntologyAccessPolicy;
import com.eidos.collab.graph.permission.Visibility;
import com.eidos.collab.graph.persistence.GraphPersistenceWriter;
import com.eidos.collab.graph.persistence.InMemoryGraphStateRepository;
import com.eidos.collab.graph.presence.PresenceInfo;
import com.eidos.collab.graph.presence.SessionRegistry;
import com.eidos.collab.graph.store.ConceptChange;
import com.eidos.collab.graph.store.GraphStoreRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SynchronizationHubTest {

    private static final long PUBLIC_ONTOLOGY = 10;
    private static final long PRIVATE_ONTOLOGY = 20;

    private MutableClock clock;
    private GraphStoreRegistry registry;
    private SynchronizationHub hub;

    @BeforeEach
    void setUp() {
        hub = newHub(SyncSettings.defaults());
    }

    private SynchronizationHub newHub(SyncSettings settings) {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        InMemoryPermissionGate gate = new InMemoryPermissionGate();
        gate.register(new OntologyAccessPolicy(PUBLIC_ONTOLOGY, "alice", Visibility.PUBLIC, true, Map.of()));
        gate.register(OntologyAccessPolicy.privateTo(PRIVATE_ONTOLOGY, "alice"));
        GraphPersistenceWriter writer = new GraphPersistenceWriter(new InMemoryGraphStateRepository(), Runnable::run);
        registry = new GraphStoreRegistry(writer, new GroupingEngine(settings.grouping()), settings.lockWait());
        return new SynchronizationHub(registry, gate, new SessionRegistry(), settings, clock);
    }

    private String join(String userId, long ontologyId) {
        ClientConnection connection = hub.openConnection(userId, userId.toUpperCase());
        hub.joinOntology(connection.getConnectionId(), ontologyId);
        return connection.getConnectionId();
    }

    private List<HubEvent> drain(String connectionId) {
        return hub.findConnection(connectionId).orElseThrow().getOutbox().drain();
    }

    private static <T extends HubEvent> List<T> ofType(List<HubEvent> events, Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    @Test
    void testJoinSendsPresenceAndAnnounces() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        clock.advance(Duration.ofSeconds(1));
        String y = join("bob", PUBLIC_ONTOLOGY);

        List<HubEvent> toY = drain(y);
        assertEquals(1, toY.size());
        PresenceList list = (PresenceList) toY.get(0);
        assertEquals(List.of("alice", "bob"),
                list.users().stream().map(PresenceInfo::userId).collect(Collectors.toList()));

        List<UserJoined> joined = ofType(drain(x), UserJoined.class);
        assertEquals(1, joined.size());
        assertEquals(y, joined.get(0).user().connectionId());
        assertEquals(List.of(x, y).stream().sorted().collect(Collectors.toList()),
                hub.subscriberIds(PUBLIC_ONTOLOGY));
    }

    @Test
    void testRenameBroadcastToOthersOnce() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        ConceptChanged created = hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(null, "Animal"));
        long conceptId = created.concept().id();
        drain(x);
        drain(y);

        ConceptChanged renamed = hub.proposeConceptChange(x, PUBLIC_ONTOLOGY,
                ConceptChange.rename(conceptId, "Creature", 1L).withClientRequestId("req-7"));

        assertEquals(2, renamed.concept().version());
        List<ConceptChanged> seenByY = ofType(drain(y), ConceptChanged.class);
        assertEquals(1, seenByY.size());
        assertEquals("Creature", seenByY.get(0).concept().name());
        assertEquals(2, seenByY.get(0).concept().version());
        assertEquals(x, seenByY.get(0).originatorConnectionId());
        assertEquals("req-7", seenByY.get(0).clientRequestId());
        assertTrue(ofType(drain(x), ConceptChanged.class).isEmpty(), "originator is answered directly");
    }

    @Test
    void testBroadcastOrderMatchesCommitOrder() throws Exception {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        String observer = join("carol", PUBLIC_ONTOLOGY);
        drain(observer);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (String connection : List.of(x, y)) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 20; i++) {
                        hub.proposeConceptChange(connection, PUBLIC_ONTOLOGY,
                                ConceptChange.create(null, connection + "-" + i));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<Long> revisions = ofType(drain(observer), ConceptChanged.class).stream()
                .map(MutationEvent::revision)
                .collect(Collectors.toList());
        assertEquals(40, revisions.size());
        for (int i = 0; i < revisions.size(); i++) {
            assertEquals(i + 1L, revisions.get(i));
        }
    }

    @Test
    void testPermissionDenied() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        long conceptId = hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(null, "Animal"))
                .concept().id();
        drain(x);

        GraphSyncException manage = assertThrows(GraphSyncException.class,
                () -> hub.proposeConceptChange(y, PUBLIC_ONTOLOGY, ConceptChange.delete(conceptId)));
        assertEquals(ReasonCode.PERMISSION_DENIED, manage.getReason());
        assertTrue(drain(x).isEmpty(), "rejections are never broadcast");
        assertEquals(1, hub.snapshot(x, PUBLIC_ONTOLOGY).revision());

        GraphSyncException privateJoin = assertThrows(GraphSyncException.class,
                () -> hub.joinOntology(y, PRIVATE_ONTOLOGY));
        assertEquals(ReasonCode.PERMISSION_DENIED, privateJoin.getReason());
        assertTrue(hub.findConnection(y).orElseThrow().isJoinedTo(PUBLIC_ONTOLOGY));

        assertEquals(ReasonCode.PERMISSION_DENIED,
                assertThrows(GraphSyncException.class, () -> hub.joinOntology(y, 99)).getReason());
        assertEquals(ReasonCode.PERMISSION_DENIED, assertThrows(GraphSyncException.class,
                () -> hub.proposeConceptChange(y, PRIVATE_ONTOLOGY, ConceptChange.create(null, "X"))).getReason());
        assertEquals(ReasonCode.NOT_FOUND, assertThrows(GraphSyncException.class,
                () -> hub.proposeConceptChange("nope", PUBLIC_ONTOLOGY, ConceptChange.create(null, "X"))).getReason());
        assertEquals(ReasonCode.PERMISSION_DENIED,
                assertThrows(GraphSyncException.class, () -> hub.openConnection(" ", "anon")).getReason());
    }

    @Test
    void testRepeatedExpandIsNotBroadcast() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(1L, "Parent"));
        hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(2L, "Child"));
        GroupChanged created = hub.proposeGroupChange(x, PUBLIC_ONTOLOGY, GroupChange.create(1, List.of(2L)));
        long groupId = created.group().id();

        GroupChanged first = hub.proposeGroupChange(y, PUBLIC_ONTOLOGY, GroupChange.expand(groupId));
        GroupChanged second = hub.proposeGroupChange(y, PUBLIC_ONTOLOGY, GroupChange.expand(groupId));

        assertEquals(first.revision(), second.revision());
        assertFalse(second.group().collapsed());
        List<GroupChanged> seenByX = ofType(drain(x), GroupChanged.class);
        assertEquals(1, seenByX.size(), "only the first expand reaches other members");
        assertEquals(List.of(2L), seenByX.get(0).expansion().revealedConceptIds());
        assertEquals(ChangeType.ADDED, ofType(drain(y), GroupChanged.class).get(0).changeType());
    }

    @Test
    void testJoiningAnotherOntologyLeavesTheFirst() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        drain(y);

        hub.joinOntology(x, PRIVATE_ONTOLOGY);

        List<UserLeft> left = ofType(drain(y), UserLeft.class);
        assertEquals(1, left.size());
        assertEquals(LeaveReason.LEFT, left.get(0).reason());
        assertEquals(List.of(y), hub.subscriberIds(PUBLIC_ONTOLOGY));
        assertEquals(List.of(x), hub.subscriberIds(PRIVATE_ONTOLOGY));
        assertEquals(ConnectionState.JOINED, hub.findConnection(x).orElseThrow().getState());
    }

    @Test
    void testHeartbeatTimeoutEvictsSilentConnection() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        drain(y);

        clock.advance(Duration.ofSeconds(30));
        assertTrue(hub.heartbeat(y, PUBLIC_ONTOLOGY));
        clock.advance(Duration.ofSeconds(31));

        List<PresenceInfo> evicted = hub.evictStale(clock.instant());

        assertEquals(1, evicted.size());
        assertEquals(x, evicted.get(0).connectionId());
        List<UserLeft> left = ofType(drain(y), UserLeft.class);
        assertEquals(1, left.size());
        assertEquals(LeaveReason.TIMED_OUT, left.get(0).reason());
        assertEquals("alice", left.get(0).userId());
        assertTrue(hub.findConnection(x).isEmpty());
        assertEquals(List.of(y), hub.subscriberIds(PUBLIC_ONTOLOGY));
        assertFalse(hub.heartbeat(x, PUBLIC_ONTOLOGY));
    }

    @Test
    void testViewNameValidation() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        drain(x);

        assertFalse(hub.updateCurrentView(y, PUBLIC_ONTOLOGY, "  "));
        assertFalse(hub.updateCurrentView(y, PUBLIC_ONTOLOGY, "v".repeat(51)));
        assertFalse(hub.updateCurrentView(y, PRIVATE_ONTOLOGY, "Taxonomy"));
        assertTrue(drain(x).isEmpty());

        assertTrue(hub.updateCurrentView(y, PUBLIC_ONTOLOGY, "Taxonomy"));
        List<UserViewChanged> changed = ofType(drain(x), UserViewChanged.class);
        assertEquals(1, changed.size());
        assertEquals("Taxonomy", changed.get(0).viewName());
        assertEquals("Taxonomy", hub.getSessions().find(y).orElseThrow().currentView());
    }

    @Test
    void testSnapshotClearsPendingResync() {
        hub = newHub(SyncSettings.defaults().withOutboxCapacity(2));
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(null, "A"));
        hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(null, "B"));

        ClientConnection connection = hub.findConnection(y).orElseThrow();
        assertTrue(connection.getOutbox().isResyncPending());

        HubSnapshot snapshot = hub.snapshot(y, PUBLIC_ONTOLOGY);

        assertFalse(connection.getOutbox().isResyncPending());
        assertEquals(2, snapshot.revision());
        assertEquals(2, snapshot.visibleGraph().conceptIds().size());
    }

    @Test
    void testCanCreateGroupNeverThrows() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(1L, "Parent"));
        hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(2L, "Child"));

        assertTrue(hub.canCreateGroup(x, PUBLIC_ONTOLOGY, 1, List.of(2L)));
        assertFalse(hub.canCreateGroup(x, PUBLIC_ONTOLOGY, 1, List.of(1L)));
        assertFalse(hub.canCreateGroup(x, PUBLIC_ONTOLOGY, 1, List.of()));
        assertFalse(hub.canCreateGroup("nope", PUBLIC_ONTOLOGY, 1, List.of(2L)));
        assertFalse(hub.canCreateGroup(x, 99, 1, List.of(2L)));
    }

    @Test
    void testMissingConnectionIdIsIgnored() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        drain(x);

        assertFalse(hub.canCreateGroup(null, PUBLIC_ONTOLOGY, 1, List.of(2L)));
        assertFalse(hub.heartbeat(null, PUBLIC_ONTOLOGY));
        assertFalse(hub.updateCurrentView(null, PUBLIC_ONTOLOGY, "Taxonomy"));
        hub.disconnect(null);

        assertTrue(drain(x).isEmpty());
        assertEquals(List.of(x), hub.subscriberIds(PUBLIC_ONTOLOGY));
    }

    @Test
    void testJoinRacingDisconnectLeavesNoSubscriber() throws Exception {
        ClientConnection connection = hub.openConnection("alice", "Alice");
        String id = connection.getConnectionId();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        AtomicReference<Thread> joiner = new AtomicReference<>();
        try {
            Future<?> joining;
            Future<?> closing;
            synchronized (connection) {
                joining = pool.submit(() -> {
                    joiner.set(Thread.currentThread());
                    return hub.joinOntology(id, PUBLIC_ONTOLOGY);
                });
                awaitBlocked(joiner);
                closing = pool.submit(() -> hub.disconnect(id));
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                while (hub.findConnection(id).isPresent() && System.nanoTime() < deadline) {
                    Thread.sleep(5);
                }
            }
            closing.get(5, TimeUnit.SECONDS);
            ExecutionException failure = assertThrows(ExecutionException.class,
                    () -> joining.get(5, TimeUnit.SECONDS));
            assertEquals(ReasonCode.NOT_FOUND, ((GraphSyncException) failure.getCause()).getReason());
        } finally {
            pool.shutdownNow();
        }

        assertTrue(hub.subscriberIds(PUBLIC_ONTOLOGY).isEmpty());
        assertTrue(hub.getSessions().find(id).isEmpty());
        assertEquals(ConnectionState.DISCONNECTED, connection.getState());
    }

    @Test
    void testDisconnectAfterJoinRemovesSubscriber() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        drain(y);

        hub.disconnect(x);

        assertEquals(List.of(y), hub.subscriberIds(PUBLIC_ONTOLOGY));
        assertEquals(LeaveReason.DISCONNECTED, ofType(drain(y), UserLeft.class).get(0).reason());
        assertEquals(ReasonCode.NOT_FOUND,
                assertThrows(GraphSyncException.class, () -> hub.joinOntology(x, PUBLIC_ONTOLOGY)).getReason());
        assertEquals(List.of(y), hub.subscriberIds(PUBLIC_ONTOLOGY));
    }

    @Test
    void testEvictingOrphanedSessionTellsMembers() {
        String y = join("bob", PUBLIC_ONTOLOGY);
        drain(y);
        hub.getSessions().register(new PresenceInfo("orphan", "carol", "Carol", PUBLIC_ONTOLOGY,
                clock.instant(), clock.instant(), "#000000", null));

        clock.advance(Duration.ofSeconds(45));
        assertTrue(hub.heartbeat(y, PUBLIC_ONTOLOGY));
        clock.advance(Duration.ofSeconds(30));
        List<PresenceInfo> evicted = hub.evictStale(clock.instant());

        assertEquals(List.of("orphan"),
                evicted.stream().map(PresenceInfo::connectionId).collect(Collectors.toList()));
        List<UserLeft> left = ofType(drain(y), UserLeft.class);
        assertEquals(1, left.size());
        assertEquals("orphan", left.get(0).connectionId());
        assertEquals(List.of(y), hub.subscriberIds(PUBLIC_ONTOLOGY));
        assertTrue(hub.activeOntologies().contains(PUBLIC_ONTOLOGY));
    }

    @Test
    void testLastMemberLeavingReleasesOntology() {
        String x = join("alice", PUBLIC_ONTOLOGY);
        String y = join("bob", PUBLIC_ONTOLOGY);
        hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(1L, "Animal"));
        assertEquals(Set.of(PUBLIC_ONTOLOGY), registry.openOntologies());

        hub.leaveOntology(x, PUBLIC_ONTOLOGY);
        assertEquals(Set.of(PUBLIC_ONTOLOGY), registry.openOntologies(), "bob is still a member");

        hub.disconnect(y);
        assertTrue(hub.subscriberIds(PUBLIC_ONTOLOGY).isEmpty());
        assertTrue(hub.activeOntologies().isEmpty());
        assertTrue(registry.openOntologies().isEmpty());

        hub.joinOntology(x, PUBLIC_ONTOLOGY);
        HubSnapshot reloaded = hub.snapshot(x, PUBLIC_ONTOLOGY);
        assertEquals(1, reloaded.revision());
        assertEquals("Animal", reloaded.snapshot().findConcept(1).orElseThrow().name());
        ConceptChanged next = hub.proposeConceptChange(x, PUBLIC_ONTOLOGY, ConceptChange.create(null, "Plant"));
        assertEquals(2, next.revision());
    }

    @Test
    void testEvictingLastMemberReleasesOntology() {
        String x = join("alice", PUBLIC_ONTOLOGY);

        clock.advance(Duration.ofSeconds(61));
        hub.evictStale(clock.instant());

        assertTrue(hub.findConnection(x).isEmpty());
        assertTrue(hub.subscriberIds(PUBLIC_ONTOLOGY).isEmpty());
        assertTrue(hub.activeOntologies().isEmpty());
        assertTrue(registry.openOntologies().isEmpty());
    }

    private static void awaitBlocked(AtomicReference<Thread> thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            Thread waiting = thread.get();
            if (waiting != null && waiting.getState() == Thread.State.BLOCKED) {
                return;
            }
            Thread.sleep(5);
        }
        fail("join never reached the connection monitor");
    }
}
