package com.eidos.collab.graph.permission;

/**
 * Decides whether a user may perform a class of action on an ontology. Consulted server-side
 * before every subscription and mutation; client-side checks are advisory only.
 */
public interface PermissionGate {

    AuthorizationDecision authorize(String userId, long ontologyId, Action action);
}
