package com.eidos.collab.graph.grouping;

import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.Position;
import com.eidos.collab.graph.store.GraphView;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Places concepts revealed by an expansion on a ring around the group's parent.
 * <p>
 * Each revealed concept, in ascending id order, tries {@code candidateAngles} evenly spaced angles
 * at {@code expansionRadius}. A candidate scores the sum of its distances to the occupied nodes,
 * minus {@code proximityPenalty} for each one closer than {@code minClearance}. The highest score
 * wins, ties go to the lowest angle index, and the chosen spot is occupied for the next concept.
 * The result depends only on the graph state.
 * </p>
 */
public final class ExpansionLayout {

    private final GroupingSettings settings;

    public ExpansionLayout(GroupingSettings settings) {
        this.settings = settings;
    }

    /**
     * @param view graph state before the expansion
     * @param group the group being expanded
     * @param visibleBefore concepts visible before the expansion
     * @param revealed concepts to place, ascending
     * @return position per revealed concept, in placement order
     */
    public Map<Long, Position> place(GraphView view, ConceptGroup group, Collection<Long> visibleBefore,
                                     List<Long> revealed) {
        Position center = view.findConcept(group.parentConceptId())
                .map(Concept::position)
                .orElse(null);
        if (center == null) {
            center = Position.ORIGIN;
        }

        Set<Long> children = group.childConceptIds();
        List<Position> occupied = new ArrayList<>();
        for (Long conceptId : visibleBefore) {
            if (conceptId == group.parentConceptId() || children.contains(conceptId) || revealed.contains(conceptId)) {
                continue;
            }
            view.findConcept(conceptId).map(Concept::position).ifPresent(occupied::add);
        }
        for (Individual individual : view.individuals()) {
            if (individual.position() != null) {
                occupied.add(individual.position());
            }
        }

        Map<Long, Position> placed = new LinkedHashMap<>();
        for (Long conceptId : revealed) {
            Position best = bestCandidate(center, occupied);
            placed.put(conceptId, best);
            occupied.add(best);
        }
        return placed;
    }

    Position bestCandidate(Position center, List<Position> occupied) {
        int angles = settings.candidateAngles();
        Position best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < angles; i++) {
            double angle = 2 * Math.PI * i / angles;
            Position candidate = new Position(center.x() + settings.expansionRadius() * Math.cos(angle),
                    center.y() + settings.expansionRadius() * Math.sin(angle));
            double score = score(candidate, occupied);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }

    private double score(Position candidate, List<Position> occupied) {
        double score = 0;
        for (Position other : occupied) {
            double distance = candidate.distanceTo(other);
            score += distance;
            if (distance < settings.minClearance()) {
                score -= settings.proximityPenalty();
            }
        }
        return score;
    }
}
