package com.eidos.collab.graph.grouping;

public enum GroupAction {
    /** Create a group, or extend the existing group of the same parent. */
    CREATE,
    EXPAND,
    COLLAPSE,
    /** Expand and remove the group. */
    DELETE,
    ADD_CHILDREN,
    /** Remove children; removing the last one deletes the group. */
    REMOVE_CHILDREN
}
