package com.eidos.collab.graph.grouping;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.model.ChangeType;
import com.eidos.collab.graph.model.CollapsedRelationship;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.GraphEdge;
import com.eidos.collab.graph.model.Position;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.store.GraphTransaction;
import com.eidos.collab.graph.store.GraphView;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates and applies group operations: create, expand, collapse, delete and membership changes.
 * <p>
 * Containment is the relation from a group's parent to each of its children. It must stay acyclic,
 * child sets never overlap, a group's parent is never one of its own children, and the number of
 * nested group levels stays within {@link GroupingSettings#maxDepth()}.
 * </p>
 * Validation is read-only and runs on any {@link GraphView}; mutations run on a {@link GraphTransaction}
 * under the ontology's write lock.
 */
public class GroupingEngine {
    private static final Logger LOG = Logger.getLogger(GroupingEngine.class);

    private final GroupingSettings settings;
    private final ExpansionLayout layout;

    public GroupingEngine(GroupingSettings settings) {
        this.settings = settings;
        this.layout = new ExpansionLayout(settings);
    }

    public GroupingSettings getSettings() {
        return settings;
    }

    /**
     * Speculative check run while a drag is in progress. Never throws and has no side effects.
     */
    public boolean canCreateGroup(GraphView view, long parentConceptId, Collection<Long> candidateChildIds) {
        return validateGroup(view, parentConceptId, candidateChildIds).isEmpty();
    }

    /**
     * First reason the group cannot be created, or empty when it can. When the parent already has a
     * group the candidates are merged into it, so children already in that group are accepted.
     */
    public Optional<ReasonCode> validateGroup(GraphView view, long parentConceptId, Collection<Long> candidateChildIds) {
        if (candidateChildIds == null || candidateChildIds.isEmpty()) {
            return Optional.of(ReasonCode.INVALID_REQUEST);
        }
        if (!view.hasConcept(parentConceptId)) {
            return Optional.of(ReasonCode.NOT_FOUND);
        }
        Set<Long> candidates = new LinkedHashSet<>(candidateChildIds);
        for (Long candidate : candidates) {
            if (candidate == null || !view.hasConcept(candidate)) {
                return Optional.of(ReasonCode.INVALID_REFERENCE);
            }
        }
        for (Long candidate : candidates) {
            Optional<ConceptGroup> owner = view.findGroupContainingChild(candidate);
            if (owner.isPresent() && owner.get().parentConceptId() != parentConceptId) {
                return Optional.of(ReasonCode.ALREADY_GROUPED);
            }
        }
        if (candidates.contains(parentConceptId)) {
            return Optional.of(ReasonCode.CIRCULAR_REFERENCE);
        }
        if (reachesThroughContainment(view, candidates, parentConceptId)) {
            return Optional.of(ReasonCode.CIRCULAR_REFERENCE);
        }
        Set<Long> resultingChildren = new LinkedHashSet<>(candidates);
        view.findGroupByParent(parentConceptId).ifPresent(g -> resultingChildren.addAll(g.childConceptIds()));
        int depth = ancestorLevels(view, parentConceptId) + 1 + descendantLevels(view, resultingChildren, new HashSet<>());
        if (depth > settings.maxDepth()) {
            return Optional.of(ReasonCode.DEPTH_EXCEEDED);
        }
        return Optional.empty();
    }

    /**
     * Breadth-first search from the start concepts over parent to child containment.
     */
    static boolean reachesThroughContainment(GraphView view, Collection<Long> start, long target) {
        Deque<Long> queue = new ArrayDeque<>(start);
        Set<Long> visited = new HashSet<>(start);
        while (!queue.isEmpty()) {
            long current = queue.poll();
            Optional<ConceptGroup> group = view.findGroupByParent(current);
            if (group.isEmpty()) {
                continue;
            }
            for (Long child : group.get().childConceptIds()) {
                if (child == target) {
                    return true;
                }
                if (visited.add(child)) {
                    queue.add(child);
                }
            }
        }
        return false;
    }

    /**
     * Number of groups enclosing the concept.
     */
    static int ancestorLevels(GraphView view, long conceptId) {
        int levels = 0;
        Set<Long> visited = new HashSet<>();
        long current = conceptId;
        while (visited.add(current)) {
            Optional<ConceptGroup> owner = view.findGroupContainingChild(current);
            if (owner.isEmpty()) {
                break;
            }
            levels++;
            current = owner.get().parentConceptId();
        }
        return levels;
    }

    /**
     * Deepest chain of groups below the given concepts.
     */
    static int descendantLevels(GraphView view, Collection<Long> conceptIds, Set<Long> visited) {
        int deepest = 0;
        for (Long conceptId : conceptIds) {
            if (!visited.add(conceptId)) {
                continue;
            }
            Optional<ConceptGroup> group = view.findGroupByParent(conceptId);
            if (group.isPresent()) {
                deepest = Math.max(deepest, 1 + descendantLevels(view, group.get().childConceptIds(), visited));
            }
        }
        return deepest;
    }

    public GroupChangeResult apply(GraphTransaction tx, String userId, GroupChange change) {
        if (change.action() == null) {
            throw GraphSyncException.invalidRequest(tx.ontologyId(), "Group action is required");
        }
        switch (change.action()) {
            case CREATE: {
                if (change.parentConceptId() == null) {
                    throw GraphSyncException.invalidRequest(tx.ontologyId(), "Group parent concept is required");
                }
                boolean merged = tx.findGroupByParent(change.parentConceptId()).isPresent();
                ConceptGroup group = createGroup(tx, userId, change.parentConceptId(), change.childConceptIds(),
                        change.groupName(), change.groupId());
                return new GroupChangeResult(GroupAction.CREATE, merged ? ChangeType.UPDATED : ChangeType.ADDED,
                        group, null, true);
            }
            case EXPAND: {
                ConceptGroup group = requireGroup(tx, change);
                if (!group.collapsed()) {
                    return new GroupChangeResult(GroupAction.EXPAND, ChangeType.UPDATED, group,
                            ExpansionResult.none(group.id()), false);
                }
                ExpansionResult expansion = expandGroup(tx, group.id());
                return new GroupChangeResult(GroupAction.EXPAND, ChangeType.UPDATED, requireGroup(tx, group.id()),
                        expansion, true);
            }
            case COLLAPSE: {
                ConceptGroup group = requireGroup(tx, change);
                if (group.collapsed()) {
                    return new GroupChangeResult(GroupAction.COLLAPSE, ChangeType.UPDATED, group, null, false);
                }
                return new GroupChangeResult(GroupAction.COLLAPSE, ChangeType.UPDATED,
                        collapseGroup(tx, group.id()), null, true);
            }
            case DELETE: {
                ConceptGroup group = requireGroup(tx, change);
                ExpansionResult expansion = deleteGroup(tx, group.id());
                return new GroupChangeResult(GroupAction.DELETE, ChangeType.DELETED, group, expansion, true);
            }
            case ADD_CHILDREN: {
                ConceptGroup group = requireGroup(tx, change);
                ConceptGroup updated = addToGroup(tx, group.id(), change.childConceptIds());
                return new GroupChangeResult(GroupAction.ADD_CHILDREN, ChangeType.UPDATED, updated, null, true);
            }
            case REMOVE_CHILDREN: {
                ConceptGroup group = requireGroup(tx, change);
                Optional<ConceptGroup> remaining = removeFromGroup(tx, group.id(), change.childConceptIds());
                return remaining
                        .map(g -> new GroupChangeResult(GroupAction.REMOVE_CHILDREN, ChangeType.UPDATED, g, null, true))
                        .orElseGet(() -> new GroupChangeResult(GroupAction.REMOVE_CHILDREN, ChangeType.DELETED,
                                group, null, true));
            }
            default:
                throw new IllegalArgumentException("Unsupported group action " + change.action());
        }
    }

    /**
     * Creates a collapsed group, or extends the existing group of the same parent. Every relationship
     * touching the parent or a child is recorded once.
     */
    public ConceptGroup createGroup(GraphTransaction tx, String userId, long parentConceptId,
                                    Collection<Long> childConceptIds, String groupName, Long proposedId) {
        Optional<ReasonCode> rejection = validateGroup(tx, parentConceptId, childConceptIds);
        if (rejection.isPresent()) {
            throw new GraphSyncException(rejection.get(), tx.ontologyId(),
                    String.format("Cannot group %s under concept %d: %s", childConceptIds, parentConceptId,
                            rejection.get()));
        }
        Optional<ConceptGroup> existing = tx.findGroupByParent(parentConceptId);
        ConceptGroup group;
        if (existing.isPresent()) {
            ConceptGroup current = existing.get();
            Set<Long> children = new LinkedHashSet<>(current.childConceptIds());
            children.addAll(childConceptIds);
            List<CollapsedRelationship> records = captureRelationships(tx, parentConceptId, children);
            group = new ConceptGroup(current.id(), current.ontologyId(), current.createdBy(), parentConceptId,
                    children, true, groupName != null ? groupName : current.groupName(), records,
                    current.version() + 1);
            LOG.debugf("Extended group %d of ontology %d to children %s", group.id(), tx.ontologyId(), children);
        } else {
            long id = tx.allocateGroupId(proposedId);
            Set<Long> children = new LinkedHashSet<>(childConceptIds);
            List<CollapsedRelationship> records = captureRelationships(tx, parentConceptId, children);
            group = new ConceptGroup(id, tx.ontologyId(), userId, parentConceptId, children, true, groupName,
                    records, 1L);
            LOG.debugf("Created group %d of ontology %d: parent %d, children %s, %d relationships recorded",
                    id, tx.ontologyId(), parentConceptId, children, records.size());
        }
        tx.putGroup(group);
        return group;
    }

    /**
     * Records every relationship touching the parent or a child, once each, in id order.
     */
    static List<CollapsedRelationship> captureRelationships(GraphView view, long parentConceptId,
                                                            Collection<Long> childConceptIds) {
        Set<Long> grouped = new LinkedHashSet<>();
        grouped.add(parentConceptId);
        grouped.addAll(childConceptIds);
        List<CollapsedRelationship> records = new ArrayList<>();
        for (Relationship relationship : view.relationshipsTouching(grouped)) {
            records.add(CollapsedRelationship.capture(relationship, grouped));
        }
        return records;
    }

    /**
     * Marks the group expanded and places the revealed concepts. The group keeps its id and records
     * so it can be collapsed again.
     */
    public ExpansionResult expandGroup(GraphTransaction tx, long groupId) {
        ConceptGroup group = requireGroup(tx, groupId);
        if (!group.collapsed()) {
            return ExpansionResult.none(groupId);
        }
        VisibleGraph before = VisibleGraph.project(tx);
        tx.putGroup(group.withCollapsed(false, group.collapsedRelationships()));
        return reveal(tx, group, before);
    }

    /**
     * Collapses the group again from its recorded relationships. Records whose relationship was
     * deleted or no longer touches the group are dropped.
     */
    public ConceptGroup collapseGroup(GraphTransaction tx, long groupId) {
        ConceptGroup group = requireGroup(tx, groupId);
        if (group.collapsed()) {
            return group;
        }
        Set<Long> grouped = group.groupedConceptIds();
        List<CollapsedRelationship> kept = new ArrayList<>();
        for (CollapsedRelationship record : group.collapsedRelationships()) {
            Optional<Relationship> relationship = tx.findRelationship(record.relationshipId());
            if (relationship.isPresent() && record.matches(relationship.get(), grouped)) {
                kept.add(record);
            } else {
                LOG.infof("Dropped stale collapse record of relationship %d from group %d of ontology %d",
                        record.relationshipId(), groupId, tx.ontologyId());
            }
        }
        ConceptGroup collapsed = group.withCollapsed(true, kept);
        tx.putGroup(collapsed);
        return collapsed;
    }

    /**
     * Expands the group if it is collapsed and removes it.
     */
    public ExpansionResult deleteGroup(GraphTransaction tx, long groupId) {
        ConceptGroup group = requireGroup(tx, groupId);
        VisibleGraph before = VisibleGraph.project(tx);
        tx.removeGroup(groupId);
        LOG.debugf("Deleted group %d of ontology %d", groupId, tx.ontologyId());
        if (!group.collapsed()) {
            return ExpansionResult.none(groupId);
        }
        return reveal(tx, group, before);
    }

    public ConceptGroup addToGroup(GraphTransaction tx, long groupId, Collection<Long> childConceptIds) {
        ConceptGroup group = requireGroup(tx, groupId);
        return createGroup(tx, group.createdBy(), group.parentConceptId(), childConceptIds, null, null);
    }

    /**
     * Removes children from a group, keeping its collapsed state. Removing the last child deletes
     * the group, in which case the result is empty.
     */
    public Optional<ConceptGroup> removeFromGroup(GraphTransaction tx, long groupId, Collection<Long> childConceptIds) {
        ConceptGroup group = requireGroup(tx, groupId);
        if (childConceptIds == null || childConceptIds.isEmpty()) {
            throw GraphSyncException.invalidRequest(tx.ontologyId(), "No children to remove from group " + groupId);
        }
        for (Long child : childConceptIds) {
            if (child == null || !group.containsChild(child)) {
                throw GraphSyncException.invalidReference(tx.ontologyId(),
                        String.format("Concept %s is not a child of group %d", child, groupId));
            }
        }
        Set<Long> remaining = new LinkedHashSet<>(group.childConceptIds());
        remaining.removeAll(childConceptIds);
        if (remaining.isEmpty()) {
            tx.removeGroup(groupId);
            LOG.debugf("Deleted group %d of ontology %d, its last children were removed", groupId, tx.ontologyId());
            return Optional.empty();
        }
        ConceptGroup updated = group.withMembers(remaining, group.collapsed(),
                captureRelationships(tx, group.parentConceptId(), remaining));
        tx.putGroup(updated);
        return Optional.of(updated);
    }

    private ExpansionResult reveal(GraphTransaction tx, ConceptGroup group, VisibleGraph before) {
        VisibleGraph after = VisibleGraph.project(tx);
        Set<Long> visibleBefore = before.visibleConceptIds();
        List<Long> revealed = after.conceptIds().stream()
                .filter(id -> !visibleBefore.contains(id))
                .sorted()
                .collect(Collectors.toList());

        Set<String> edgesAfter = after.visibleEdgeIds();
        List<String> removedSynthetic = before.edgesOf(GraphEdge.Rerouted.class).stream()
                .map(GraphEdge::edgeId)
                .filter(id -> !edgesAfter.contains(id))
                .collect(Collectors.toList());

        Set<Long> directBefore = before.edgesOf(GraphEdge.Direct.class).stream()
                .map(GraphEdge.Direct::relationshipId)
                .collect(Collectors.toSet());
        List<Long> restored = after.edgesOf(GraphEdge.Direct.class).stream()
                .map(GraphEdge.Direct::relationshipId)
                .filter(id -> !directBefore.contains(id))
                .sorted()
                .collect(Collectors.toList());

        Map<Long, Position> positions = layout.place(tx, group, visibleBefore, revealed);
        for (Map.Entry<Long, Position> entry : positions.entrySet()) {
            Concept concept = tx.findConcept(entry.getKey()).orElseThrow();
            tx.putConcept(concept.withPosition(entry.getValue()));
        }
        LOG.debugf("Expanded group %d of ontology %d: revealed %s, removed %d rerouted edges",
                group.id(), tx.ontologyId(), revealed, removedSynthetic.size());
        return new ExpansionResult(group.id(), revealed, removedSynthetic, restored, positions);
    }

    private ConceptGroup requireGroup(GraphTransaction tx, GroupChange change) {
        if (change.groupId() == null) {
            throw GraphSyncException.invalidRequest(tx.ontologyId(), "Group id is required for " + change.action());
        }
        ConceptGroup group = requireGroup(tx, change.groupId());
        if (change.expectedVersion() != null && change.expectedVersion() != group.version()) {
            throw GraphSyncException.stale(tx.ontologyId(), "ConceptGroup", group.id(), change.expectedVersion(),
                    group.version());
        }
        return group;
    }

    private ConceptGroup requireGroup(GraphView view, long groupId) {
        return view.findGroup(groupId)
                .orElseThrow(() -> GraphSyncException.notFound(view.ontologyId(), "ConceptGroup", groupId));
    }
}
