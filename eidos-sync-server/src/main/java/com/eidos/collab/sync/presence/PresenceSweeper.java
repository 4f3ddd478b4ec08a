package com.eidos.collab.sync.presence;

import com.eidos.collab.graph.hub.SynchronizationHub;
import com.eidos.collab.graph.presence.PresenceInfo;
import com.eidos.collab.sync.config.SyncConfig;
import com.eidos.collab.util.ExceptionLoggingUtils;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically evicts connections that stopped sending heartbeats.
 */
@ApplicationScoped
public class PresenceSweeper {
    private static final Logger LOG = Logger.getLogger(PresenceSweeper.class);

    @Inject
    SynchronizationHub hub;

    @Inject
    SyncConfig config;

    @Inject
    Clock clock;

    private ScheduledExecutorService scheduler;

    void onStart(@Observes StartupEvent event) {
        long interval = config.sweepInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "presence-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        LOG.infof("Presence sweeper started: every %s, timeout %s", config.sweepInterval(), config.presenceTimeout());
    }

    void onStop(@Observes ShutdownEvent event) {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * One sweep. Failures are logged so the schedule keeps running.
     *
     * @return number of evicted connections
     */
    public int sweep() {
        try {
            List<PresenceInfo> evicted = hub.evictStale(clock.instant());
            if (!evicted.isEmpty()) {
                LOG.infof("Evicted %d idle connections", evicted.size());
            }
            return evicted.size();
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logError(LOG, e, "Presence sweep failed");
            return 0;
        }
    }
}
