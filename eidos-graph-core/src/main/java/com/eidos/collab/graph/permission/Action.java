package com.eidos.collab.graph.permission;

/**
 * Permission classes checked before a subscription or mutation.
 */
public enum Action {
    /** Join, snapshot and speculative group checks. */
    VIEW,
    /** Create entities. */
    ADD,
    /** Update entities and change groups. */
    EDIT,
    /** Delete entities. */
    MANAGE
}
