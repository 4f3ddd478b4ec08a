package com.eidos.collab.graph.grouping;

import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.GraphEdge;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.store.GraphView;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The graph every client renders: the concepts left visible by the collapsed groups, all
 * individuals, and one {@link GraphEdge} per relationship, instance link and individual
 * relationship.
 * <p>
 * A concept is hidden when it is a child of a collapsed group, or when the parent of its own group
 * is hidden. A hidden concept is represented by the visible parent of the outermost collapsed group
 * above it. Relationships whose endpoints both resolve to the same representative are internal;
 * relationships with one hidden endpoint are rerouted to the representative, at most once each.
 * </p>
 *
 * @param ontologyId ontology projected
 * @param revision revision of the projected state
 * @param conceptIds visible concept ids, ascending
 * @param individualIds individual ids, ascending
 * @param edges every edge, hidden internal ones included
 * @param representatives visible representative of each hidden concept
 */
public record VisibleGraph(long ontologyId,
                           long revision,
                           List<Long> conceptIds,
                           List<Long> individualIds,
                           List<GraphEdge> edges,
                           Map<Long, Long> representatives) {

    public VisibleGraph {
        conceptIds = List.copyOf(conceptIds);
        individualIds = List.copyOf(individualIds);
        edges = List.copyOf(edges);
        representatives = Map.copyOf(representatives);
    }

    public static VisibleGraph project(GraphView view) {
        Resolver resolver = new Resolver(view.groups());

        List<Long> visibleConcepts = new ArrayList<>();
        Map<Long, Long> hidden = new LinkedHashMap<>();
        for (Concept concept : view.concepts()) {
            Resolution resolution = resolver.resolve(concept.id());
            if (resolution.hidden()) {
                hidden.put(concept.id(), resolution.representative());
            } else {
                visibleConcepts.add(concept.id());
            }
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (Relationship relationship : view.relationships()) {
            edges.add(edgeFor(relationship, resolver));
        }
        List<Long> individualIds = new ArrayList<>();
        for (Individual individual : view.individuals()) {
            individualIds.add(individual.id());
            long typeRepresentative = resolver.resolve(individual.conceptTypeId()).representative();
            edges.add(new GraphEdge.InstanceOf(individual.id(), individual.id(), typeRepresentative));
        }
        for (IndividualRelationship link : view.individualRelationships()) {
            edges.add(new GraphEdge.IndividualLink(link.id(), link.sourceIndividualId(), link.targetIndividualId(),
                    link.relationType()));
        }
        return new VisibleGraph(view.ontologyId(), view.revision(), visibleConcepts, individualIds, edges, hidden);
    }

    private static GraphEdge edgeFor(Relationship relationship, Resolver resolver) {
        Resolution source = resolver.resolve(relationship.sourceConceptId());
        Resolution target = resolver.resolve(relationship.targetConceptId());
        if (!source.hidden() && !target.hidden()) {
            return new GraphEdge.Direct(relationship.id(), relationship.sourceConceptId(),
                    relationship.targetConceptId(), relationship.relationType());
        }
        long groupId = source.hidden() ? source.hidingGroupId() : target.hidingGroupId();
        if (source.representative() == target.representative()) {
            return new GraphEdge.Internal(relationship.id(), groupId, relationship.sourceConceptId(),
                    relationship.targetConceptId(), relationship.relationType());
        }
        return new GraphEdge.Rerouted(groupId, relationship.id(), source.representative(),
                target.representative(), relationship.relationType());
    }

    public Set<Long> visibleConceptIds() {
        return new LinkedHashSet<>(conceptIds);
    }

    public boolean isVisible(long conceptId) {
        return conceptIds.contains(conceptId);
    }

    /**
     * The concept drawn in place of the given one: itself when visible.
     */
    public long representativeOf(long conceptId) {
        return representatives.getOrDefault(conceptId, conceptId);
    }

    public List<GraphEdge> visibleEdges() {
        return edges.stream().filter(GraphEdge::visible).collect(Collectors.toList());
    }

    public Set<String> visibleEdgeIds() {
        return edges.stream().filter(GraphEdge::visible).map(GraphEdge::edgeId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Optional<GraphEdge> findEdge(String edgeId) {
        return edges.stream().filter(e -> e.edgeId().equals(edgeId)).findFirst();
    }

    public <T extends GraphEdge> List<T> edgesOf(Class<T> kind) {
        return edges.stream().filter(kind::isInstance).map(kind::cast).collect(Collectors.toList());
    }

    private record Resolution(long representative, boolean hidden, long hidingGroupId) {
    }

    /**
     * Resolves concepts to their representative by walking group containment upwards.
     */
    private static final class Resolver {
        private final Map<Long, ConceptGroup> groupOfChild = new HashMap<>();
        private final Map<Long, Resolution> cache = new HashMap<>();

        Resolver(Iterable<ConceptGroup> groups) {
            for (ConceptGroup group : groups) {
                for (Long child : group.childConceptIds()) {
                    groupOfChild.put(child, group);
                }
            }
        }

        Resolution resolve(long conceptId) {
            return resolve(conceptId, new HashSet<>());
        }

        private Resolution resolve(long conceptId, Set<Long> path) {
            Resolution cached = cache.get(conceptId);
            if (cached != null) {
                return cached;
            }
            ConceptGroup group = groupOfChild.get(conceptId);
            Resolution resolution;
            if (group == null || !path.add(conceptId)) {
                resolution = new Resolution(conceptId, false, -1L);
            } else {
                Resolution parent = resolve(group.parentConceptId(), path);
                if (parent.hidden()) {
                    resolution = new Resolution(parent.representative(), true, parent.hidingGroupId());
                } else if (group.collapsed()) {
                    resolution = new Resolution(group.parentConceptId(), true, group.id());
                } else {
                    resolution = new Resolution(conceptId, false, -1L);
                }
            }
            cache.put(conceptId, resolution);
            return resolution;
        }
    }
}
