package com.eidos.collab.graph.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An edge of the projected graph a client renders. Each variant carries only the fields
 * relevant to it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GraphEdge.Direct.class, name = "Direct"),
        @JsonSubTypes.Type(value = GraphEdge.Internal.class, name = "Internal"),
        @JsonSubTypes.Type(value = GraphEdge.Rerouted.class, name = "Rerouted"),
        @JsonSubTypes.Type(value = GraphEdge.InstanceOf.class, name = "InstanceOf"),
        @JsonSubTypes.Type(value = GraphEdge.IndividualLink.class, name = "IndividualRelationship")
})
public interface GraphEdge {

    String edgeId();

    long sourceId();

    long targetId();

    /** Whether a client draws this edge. Only internal edges are hidden. */
    default boolean visible() {
        return true;
    }

    /** A relationship shown between its own endpoints. */
    record Direct(long relationshipId, long sourceId, long targetId, String relationType) implements GraphEdge {
        @Override
        public String edgeId() {
            return "relationship:" + relationshipId;
        }
    }

    /** A relationship with both endpoints inside a collapsed group. Hidden, never deleted. */
    record Internal(long relationshipId, long groupId, long sourceId, long targetId, String relationType)
            implements GraphEdge {
        @Override
        public String edgeId() {
            return "relationship:" + relationshipId;
        }

        @Override
        public boolean visible() {
            return false;
        }
    }

    /** Synthetic edge shown in place of a hidden boundary relationship. */
    record Rerouted(long groupId, long relationshipId, long sourceId, long targetId, String relationType)
            implements GraphEdge {
        @Override
        public String edgeId() {
            return syntheticId(groupId, relationshipId);
        }

        public static String syntheticId(long groupId, long relationshipId) {
            return "rerouted:" + groupId + ":" + relationshipId;
        }
    }

    /** Links an individual to the visible representative of its concept type. */
    record InstanceOf(long individualId, long sourceId, long targetId) implements GraphEdge {
        @Override
        public String edgeId() {
            return "instance-of:" + individualId;
        }
    }

    /** A relationship between two individuals. */
    record IndividualLink(long individualRelationshipId, long sourceId, long targetId, String relationType)
            implements GraphEdge {
        @Override
        public String edgeId() {
            return "individual-relationship:" + individualRelationshipId;
        }
    }
}
