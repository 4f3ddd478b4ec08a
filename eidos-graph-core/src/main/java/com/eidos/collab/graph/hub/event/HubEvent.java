package com.eidos.collab.graph.hub.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Message pushed to the subscribers of an ontology. Serialized with a {@code type} tag.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConceptChanged.class, name = "ConceptChanged"),
        @JsonSubTypes.Type(value = RelationshipChanged.class, name = "RelationshipChanged"),
        @JsonSubTypes.Type(value = IndividualChanged.class, name = "IndividualChanged"),
        @JsonSubTypes.Type(value = IndividualRelationshipChanged.class, name = "IndividualRelationshipChanged"),
        @JsonSubTypes.Type(value = GroupChanged.class, name = "GroupChanged"),
        @JsonSubTypes.Type(value = UserJoined.class, name = "UserJoined"),
        @JsonSubTypes.Type(value = UserLeft.class, name = "UserLeft"),
        @JsonSubTypes.Type(value = UserViewChanged.class, name = "UserViewChanged"),
        @JsonSubTypes.Type(value = PresenceList.class, name = "PresenceList"),
        @JsonSubTypes.Type(value = ResyncRequired.class, name = "ResyncRequired")
})
public interface HubEvent {

    long ontologyId();
}
