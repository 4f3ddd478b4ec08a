package com.eidos.collab.graph.permission;

import java.util.Map;
import java.util.Objects;

/**
 * Who may do what on one ontology.
 *
 * @param ontologyId the ontology
 * @param ownerId user with every permission
 * @param visibility private or public
 * @param allowPublicEdit on a public ontology, lets any identified user add and edit
 * @param grants explicit per-user levels
 */
public record OntologyAccessPolicy(long ontologyId,
                                   String ownerId,
                                   Visibility visibility,
                                   boolean allowPublicEdit,
                                   Map<String, PermissionLevel> grants) {

    public OntologyAccessPolicy {
        Objects.requireNonNull(ownerId, "ownerId");
        visibility = visibility != null ? visibility : Visibility.PRIVATE;
        grants = grants != null ? Map.copyOf(grants) : Map.of();
    }

    public static OntologyAccessPolicy privateTo(long ontologyId, String ownerId) {
        return new OntologyAccessPolicy(ontologyId, ownerId, Visibility.PRIVATE, false, Map.of());
    }

    /**
     * Evaluates an identified user's request.
     */
    public boolean permits(String userId, Action action) {
        if (ownerId.equals(userId)) {
            return true;
        }
        PermissionLevel granted = grants.get(userId);
        if (granted != null && granted.allows(action)) {
            return true;
        }
        if (visibility == Visibility.PUBLIC) {
            if (action == Action.VIEW) {
                return true;
            }
            return allowPublicEdit && (action == Action.ADD || action == Action.EDIT);
        }
        return false;
    }
}
