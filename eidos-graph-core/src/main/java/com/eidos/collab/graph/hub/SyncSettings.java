package com.eidos.collab.graph.hub;

import com.eidos.collab.graph.grouping.GroupingSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the synchronization hub.
 *
 * @param lockWait how long a write waits for the ontology lock before failing with BUSY
 * @param outboxCapacity events buffered per connection before dropping
 * @param heartbeatInterval interval clients are expected to send heartbeats at
 * @param presenceTimeout idle time after which a connection is evicted
 * @param maxViewNameLength longest accepted view name
 * @param grouping grouping engine settings
 */
public record SyncSettings(Duration lockWait,
                           int outboxCapacity,
                           Duration heartbeatInterval,
                           Duration presenceTimeout,
                           int maxViewNameLength,
                           GroupingSettings grouping) {

    public static final Duration DEFAULT_LOCK_WAIT = Duration.ofSeconds(2);
    public static final int DEFAULT_OUTBOX_CAPACITY = 256;
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_VIEW_NAME_LENGTH = 50;

    public SyncSettings {
        Objects.requireNonNull(lockWait, "lockWait");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(presenceTimeout, "presenceTimeout");
        Objects.requireNonNull(grouping, "grouping");
        if (outboxCapacity < 2) {
            throw new IllegalArgumentException("outboxCapacity must be at least 2, got " + outboxCapacity);
        }
    }

    /**
     * Defaults: presence times out after two missed heartbeats.
     */
    public static SyncSettings defaults() {
        return new SyncSettings(DEFAULT_LOCK_WAIT, DEFAULT_OUTBOX_CAPACITY, DEFAULT_HEARTBEAT_INTERVAL,
                DEFAULT_HEARTBEAT_INTERVAL.multipliedBy(2), DEFAULT_MAX_VIEW_NAME_LENGTH, GroupingSettings.defaults());
    }

    public SyncSettings withPresenceTimeout(Duration timeout) {
        return new SyncSettings(lockWait, outboxCapacity, heartbeatInterval, timeout, maxViewNameLength, grouping);
    }

    public SyncSettings withOutboxCapacity(int capacity) {
        return new SyncSettings(lockWait, capacity, heartbeatInterval, presenceTimeout, maxViewNameLength, grouping);
    }
}
