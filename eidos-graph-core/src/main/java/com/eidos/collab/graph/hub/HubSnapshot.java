package com.eidos.collab.graph.hub;

import com.eidos.collab.graph.grouping.VisibleGraph;
import com.eidos.collab.graph.store.GraphSnapshot;

/**
 * Full state handed to a client that joins or resynchronizes.
 */
public record HubSnapshot(GraphSnapshot snapshot, VisibleGraph visibleGraph) {

    public long revision() {
        return snapshot.revision();
    }
}
