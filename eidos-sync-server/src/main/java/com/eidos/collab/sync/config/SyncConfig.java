package com.eidos.collab.sync.config;

import com.eidos.collab.graph.grouping.GroupingSettings;
import com.eidos.collab.graph.hub.SyncSettings;
import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps the {@code eidos.sync} properties.
 */
@StaticInitSafe
@ConfigMapping(prefix = "eidos.sync")
public interface SyncConfig {

    /**
     * How long a write waits for an ontology's lock before failing with BUSY.
     */
    @WithDefault("2s")
    Duration lockWait();

    /**
     * Events buffered per connection before the connection is asked to resync.
     */
    @WithDefault("256")
    int outboxCapacity();

    @WithDefault("30s")
    Duration heartbeatInterval();

    @WithDefault("60s")
    Duration presenceTimeout();

    /**
     * How often idle connections are swept.
     */
    @WithDefault("10s")
    Duration sweepInterval();

    @WithDefault("50")
    int maxViewNameLength();

    /**
     * How long an event stream waits on an empty outbox before checking the connection again.
     */
    @WithDefault("500ms")
    Duration eventPollInterval();

    /**
     * Classpath resource or file holding the access policies.
     */
    @WithDefault("access/policies.json")
    String accessPolicies();

    Persistence persistence();

    Grouping grouping();

    DevIdentity devIdentity();

    interface Persistence {

        /**
         * {@code memory} or {@code mongo}.
         */
        @WithDefault("memory")
        String mode();

        @WithDefault("eidos")
        String database();

        @WithDefault("2")
        int writerThreads();

        /**
         * How long shutdown waits for queued writes.
         */
        @WithDefault("10s")
        Duration flushTimeout();
    }

    interface Grouping {

        @WithDefault("5")
        int maxDepth();

        @WithDefault("150")
        double expansionRadius();

        @WithDefault("16")
        int candidateAngles();

        @WithDefault("80")
        double minClearance();

        @WithDefault("1000")
        double proximityPenalty();
    }

    interface DevIdentity {

        /**
         * Trust the {@code X-User-Id} header for unauthenticated callers. Development only.
         */
        @WithDefault("false")
        boolean enabled();

        @WithName("header")
        @WithDefault("X-User-Id")
        String headerName();

        Optional<String> defaultUser();
    }

    default SyncSettings toSettings() {
        Grouping grouping = grouping();
        return new SyncSettings(lockWait(), outboxCapacity(), heartbeatInterval(), presenceTimeout(),
                maxViewNameLength(), new GroupingSettings(grouping.maxDepth(), grouping.expansionRadius(),
                        grouping.candidateAngles(), grouping.minClearance(), grouping.proximityPenalty()));
    }
}
