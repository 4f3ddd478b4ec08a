package com.eidos.collab.graph.grouping;

/**
 * Tunables of the grouping engine.
 *
 * @param maxDepth maximum number of nested group levels
 * @param expansionRadius distance from the parent at which revealed concepts are placed
 * @param candidateAngles number of evenly spaced angles tried per revealed concept, at least 8
 * @param minClearance distance under which a candidate position is penalised
 * @param proximityPenalty score subtracted per node closer than the clearance
 */
public record GroupingSettings(int maxDepth,
                               double expansionRadius,
                               int candidateAngles,
                               double minClearance,
                               double proximityPenalty) {

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final double DEFAULT_EXPANSION_RADIUS = 150;
    public static final int DEFAULT_CANDIDATE_ANGLES = 16;
    public static final double DEFAULT_MIN_CLEARANCE = 80;
    public static final double DEFAULT_PROXIMITY_PENALTY = 1000;

    public GroupingSettings {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + maxDepth);
        }
        if (candidateAngles < 8) {
            throw new IllegalArgumentException("candidateAngles must be at least 8, got " + candidateAngles);
        }
        if (expansionRadius <= 0) {
            throw new IllegalArgumentException("expansionRadius must be positive, got " + expansionRadius);
        }
    }

    public static GroupingSettings defaults() {
        return new GroupingSettings(DEFAULT_MAX_DEPTH, DEFAULT_EXPANSION_RADIUS, DEFAULT_CANDIDATE_ANGLES,
                DEFAULT_MIN_CLEARANCE, DEFAULT_PROXIMITY_PENALTY);
    }
}
