package com.eidos.collab.graph.hub.event;

public enum LeaveReason {
    LEFT,
    DISCONNECTED,
    /** No heartbeat or activity within the presence timeout. */
    TIMED_OUT
}
