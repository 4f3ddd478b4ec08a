package com.eidos.collab.graph.permission;

public enum Visibility {
    /** Only the owner and users with a grant. */
    PRIVATE,
    /** Anyone identified may view; editing needs a grant unless public edit is allowed. */
    PUBLIC
}
