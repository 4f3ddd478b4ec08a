package com.eidos.collab.graph.presence;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Presence of every joined connection, keyed by connection id. Safe for concurrent use across
 * ontologies; updates are atomic per entry and never take an ontology lock.
 */
public class SessionRegistry {

    private static final Comparator<PresenceInfo> BY_JOIN_TIME = Comparator
            .comparing(PresenceInfo::joinedAt)
            .thenComparing(PresenceInfo::connectionId);

    private final Map<String, PresenceInfo> sessions = new ConcurrentHashMap<>();

    public void register(PresenceInfo presence) {
        sessions.put(presence.connectionId(), presence);
    }

    public Optional<PresenceInfo> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    /**
     * Refreshes the last-seen time of a connection.
     *
     * @return the updated entry, empty when the connection is not registered
     */
    public Optional<PresenceInfo> touch(String connectionId, Instant now) {
        return Optional.ofNullable(sessions.computeIfPresent(connectionId, (id, p) -> p.withLastSeenAt(now)));
    }

    public Optional<PresenceInfo> updateView(String connectionId, String viewName, Instant now) {
        return Optional.ofNullable(sessions.computeIfPresent(connectionId, (id, p) -> p.withCurrentView(viewName, now)));
    }

    public Optional<PresenceInfo> remove(String connectionId) {
        return Optional.ofNullable(sessions.remove(connectionId));
    }

    /**
     * Members of an ontology, earliest joiner first.
     */
    public List<PresenceInfo> presence(long ontologyId) {
        return sessions.values().stream()
                .filter(p -> p.ontologyId() == ontologyId)
                .sorted(BY_JOIN_TIME)
                .collect(Collectors.toList());
    }

    /**
     * Entries not seen for longer than the timeout.
     */
    public List<PresenceInfo> findStale(Instant now, Duration timeout) {
        Instant cutoff = now.minus(timeout);
        return sessions.values().stream()
                .filter(p -> p.lastSeenAt().isBefore(cutoff))
                .sorted(BY_JOIN_TIME)
                .collect(Collectors.toList());
    }

    public int size() {
        return sessions.size();
    }
}
