package com.eidos.collab.graph.permission;

public record AuthorizationDecision(boolean allowed, String deniedReason) {

    private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(true, null);

    public static AuthorizationDecision allow() {
        return ALLOWED;
    }

    public static AuthorizationDecision deny(String reason) {
        return new AuthorizationDecision(false, reason);
    }
}
