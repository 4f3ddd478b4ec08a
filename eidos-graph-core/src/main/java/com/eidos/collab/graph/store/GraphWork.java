package com.eidos.collab.graph.store;

/**
 * A unit of work run against a transaction while the ontology's write lock is held.
 */
@FunctionalInterface
public interface GraphWork<T> {
    T apply(GraphTransaction tx);
}
