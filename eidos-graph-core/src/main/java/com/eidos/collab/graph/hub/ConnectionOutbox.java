package com.eidos.collab.graph.hub;

import com.eidos.collab.graph.hub.event.HubEvent;
import com.eidos.collab.graph.hub.event.ResyncRequired;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded send buffer of one connection.
 * <p>
 * Offers never block the broadcaster. When the buffer is full the event is dropped and the
 * connection flagged; the next event that fits is preceded by a {@link ResyncRequired} telling the
 * client to fetch a fresh snapshot.
 * </p>
 */
public class ConnectionOutbox {
    private static final Logger LOG = Logger.getLogger(ConnectionOutbox.class);

    private final String connectionId;
    private final BlockingQueue<HubEvent> queue;
    private boolean resyncPending;
    private long dropped;

    public ConnectionOutbox(String connectionId, int capacity) {
        this.connectionId = connectionId;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return false when the event was dropped
     */
    public synchronized boolean offer(HubEvent event) {
        if (resyncPending) {
            if (queue.remainingCapacity() < 2) {
                dropped++;
                LOG.debugf("Outbox of connection %s still full, dropped %d events", connectionId, dropped);
                return false;
            }
            queue.offer(new ResyncRequired(event.ontologyId(), dropped));
            resyncPending = false;
            dropped = 0;
        }
        if (!queue.offer(event)) {
            resyncPending = true;
            dropped++;
            LOG.warnf("Outbox of connection %s is full, dropped %s; client will be asked to resync",
                    connectionId, event.getClass().getSimpleName());
            return false;
        }
        return true;
    }

    public HubEvent poll() {
        return queue.poll();
    }

    public HubEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public List<HubEvent> drain() {
        List<HubEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    /**
     * Called once the client has fetched a fresh snapshot.
     */
    public synchronized void clearResync() {
        resyncPending = false;
        dropped = 0;
    }

    public synchronized boolean isResyncPending() {
        return resyncPending;
    }

    public int size() {
        return queue.size();
    }
}
