package com.eidos.collab.graph.hub;

public enum ConnectionState {
    CONNECTING,
    JOINED,
    DISCONNECTED
}
