package com.eidos.collab.graph.presence;

import java.util.List;

/**
 * Stable avatar colour per user, so every client draws the same colour for the same person.
 */
public final class AvatarColors {

    public static final List<String> PALETTE = List.of(
            "#FF6B6B", "#4ECDC4", "#45B7D1", "#FFA07A", "#98D8C8",
            "#F7DC6F", "#BB8FCE", "#85C1E2", "#F8B739", "#52B788",
            "#FFB4A2", "#A8DADC", "#E07A5F", "#81B29A", "#F2CC8F");

    private AvatarColors() {
    }

    public static String forUser(String userId) {
        return PALETTE.get(Math.floorMod(userId.hashCode(), PALETTE.size()));
    }
}
