package com.eidos.collab.graph.model;

public enum ChangeType {
    ADDED,
    UPDATED,
    DELETED
}
