package com.eidos.collab.graph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A user-defined cluster of concepts shown as its parent concept while collapsed.
 * Instances are immutable; every change produces a new instance with a higher version.
 */
public record ConceptGroup(long id,
                           long ontologyId,
                           String createdBy,
                           long parentConceptId,
                           Set<Long> childConceptIds,
                           boolean collapsed,
                           String groupName,
                           List<CollapsedRelationship> collapsedRelationships,
                           long version) {

    public ConceptGroup {
        Objects.requireNonNull(childConceptIds, "childConceptIds");
        childConceptIds = Collections.unmodifiableSet(new LinkedHashSet<>(childConceptIds));
        collapsedRelationships = collapsedRelationships == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(collapsedRelationships));
    }

    /**
     * Parent plus children: the concepts whose relationships are captured on collapse.
     */
    public Set<Long> groupedConceptIds() {
        Set<Long> ids = new LinkedHashSet<>();
        ids.add(parentConceptId);
        ids.addAll(childConceptIds);
        return ids;
    }

    public boolean containsChild(long conceptId) {
        return childConceptIds.contains(conceptId);
    }

    public ConceptGroup withCollapsed(boolean value, List<CollapsedRelationship> records) {
        return new ConceptGroup(id, ontologyId, createdBy, parentConceptId, childConceptIds, value, groupName,
                records, version + 1);
    }

    public ConceptGroup withMembers(Set<Long> children, boolean value, List<CollapsedRelationship> records) {
        return new ConceptGroup(id, ontologyId, createdBy, parentConceptId, children, value, groupName,
                records, version + 1);
    }
}
