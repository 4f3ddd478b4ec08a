package com.eidos.collab.sync.stream;

import com.eidos.collab.graph.hub.ClientConnection;
import com.eidos.collab.graph.hub.ConnectionState;
import com.eidos.collab.graph.hub.event.HubEvent;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.MultiEmitter;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Drains a connection's outbox into a {@link Multi}. The stream completes once the connection is
 * disconnected or the subscriber cancels.
 */
public class HubEventStream {
    private static final Logger LOG = Logger.getLogger(HubEventStream.class);

    private final Executor executor;
    private final Duration pollInterval;

    public HubEventStream(Executor executor, Duration pollInterval) {
        this.executor = executor;
        this.pollInterval = pollInterval;
    }

    public Multi<HubEvent> events(ClientConnection connection) {
        return Multi.createFrom().emitter(emitter -> executor.execute(() -> pump(connection, emitter)));
    }

    private void pump(ClientConnection connection, MultiEmitter<? super HubEvent> emitter) {
        LOG.debugf("Streaming events to connection %s", connection.getConnectionId());
        try {
            while (!emitter.isCancelled() && connection.getState() != ConnectionState.DISCONNECTED) {
                HubEvent event = connection.getOutbox().poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (event != null) {
                    emitter.emit(event);
                }
            }
            HubEvent remaining;
            while (!emitter.isCancelled() && (remaining = connection.getOutbox().poll()) != null) {
                emitter.emit(remaining);
            }
            emitter.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.fail(e);
        }
        LOG.debugf("Event stream of connection %s ended", connection.getConnectionId());
    }
}
