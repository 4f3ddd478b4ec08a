package com.eidos.collab.graph.permission;

import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Permission gate backed by a map of access policies. Denies by default: a blank user or an
 * ontology without a policy is never allowed anything.
 */
public class InMemoryPermissionGate implements PermissionGate {
    private static final Logger LOG = Logger.getLogger(InMemoryPermissionGate.class);

    private final Map<Long, OntologyAccessPolicy> policies = new ConcurrentHashMap<>();

    public InMemoryPermissionGate() {
    }

    public InMemoryPermissionGate(Collection<OntologyAccessPolicy> initial) {
        initial.forEach(this::register);
    }

    public void register(OntologyAccessPolicy policy) {
        policies.put(policy.ontologyId(), policy);
    }

    public void remove(long ontologyId) {
        policies.remove(ontologyId);
    }

    public Optional<OntologyAccessPolicy> policy(long ontologyId) {
        return Optional.ofNullable(policies.get(ontologyId));
    }

    @Override
    public AuthorizationDecision authorize(String userId, long ontologyId, Action action) {
        if (userId == null || userId.isBlank()) {
            return AuthorizationDecision.deny("Unknown user");
        }
        OntologyAccessPolicy policy = policies.get(ontologyId);
        if (policy == null) {
            return AuthorizationDecision.deny("Unknown ontology " + ontologyId);
        }
        if (policy.permits(userId, action)) {
            return AuthorizationDecision.allow();
        }
        LOG.debugf("Denied %s on ontology %d to user %s", action, ontologyId, userId);
        return AuthorizationDecision.deny(String.format("User %s may not %s ontology %d", userId,
                action.name().toLowerCase(), ontologyId));
    }
}
