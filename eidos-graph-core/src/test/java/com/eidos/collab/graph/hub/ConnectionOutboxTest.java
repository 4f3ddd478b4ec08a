package com.eidos.collab.graph.hub;

import com.eidos.collab.graph.hub.event.HubEvent;
import com.eidos.collab.graph.hub.event.ResyncRequired;
import com.eidos.collab.graph.hub.event.UserViewChanged;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionOutboxTest {

    private static HubEvent event(int n) {
        return new UserViewChanged(10, "c" + n, "alice", "view-" + n);
    }

    @Test
    void testOverflowIsReplacedByResync() {
        ConnectionOutbox outbox = new ConnectionOutbox("x", 2);
        assertTrue(outbox.offer(event(1)));
        assertTrue(outbox.offer(event(2)));
        assertFalse(outbox.offer(event(3)));
        assertFalse(outbox.offer(event(4)));
        assertTrue(outbox.isResyncPending());

        assertEquals(List.of(event(1), event(2)), outbox.drain());
        assertTrue(outbox.offer(event(5)));

        assertEquals(List.of(new ResyncRequired(10, 2), event(5)), outbox.drain());
        assertFalse(outbox.isResyncPending());
    }

    @Test
    void testResyncWaitsForRoomForBoth() {
        ConnectionOutbox outbox = new ConnectionOutbox("x", 2);
        outbox.offer(event(1));
        outbox.offer(event(2));
        outbox.offer(event(3));
        assertEquals(event(1), outbox.poll());

        assertFalse(outbox.offer(event(4)), "one free slot cannot hold the resync notice and the event");
        assertEquals(1, outbox.size());
    }

    @Test
    void testClearResyncAfterSnapshot() throws InterruptedException {
        ConnectionOutbox outbox = new ConnectionOutbox("x", 2);
        outbox.offer(event(1));
        outbox.offer(event(2));
        outbox.offer(event(3));
        outbox.drain();
        outbox.clearResync();

        assertTrue(outbox.offer(event(4)));
        assertEquals(event(4), outbox.poll(10, TimeUnit.MILLISECONDS));
        assertNull(outbox.poll(10, TimeUnit.MILLISECONDS));
    }
}
