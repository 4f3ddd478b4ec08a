package com.eidos.collab.sync.rest;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.graph.grouping.GroupChange;
import com.eidos.collab.graph.hub.ClientConnection;
import com.eidos.collab.graph.hub.SynchronizationHub;
import com.eidos.collab.graph.hub.event.ConceptChanged;
import com.eidos.collab.graph.hub.event.GroupChanged;
import com.eidos.collab.graph.hub.event.HubEvent;
import com.eidos.collab.graph.hub.event.IndividualChanged;
import com.eidos.collab.graph.hub.event.IndividualRelationshipChanged;
import com.eidos.collab.graph.hub.event.RelationshipChanged;
import com.eidos.collab.graph.presence.PresenceInfo;
import com.eidos.collab.graph.store.ConceptChange;
import com.eidos.collab.graph.store.IndividualChange;
import com.eidos.collab.graph.store.IndividualRelationshipChange;
import com.eidos.collab.graph.store.RelationshipChange;
import com.eidos.collab.sync.rest.models.CanCreateGroupRequest;
import com.eidos.collab.sync.rest.models.CanCreateGroupResponse;
import com.eidos.collab.sync.rest.models.ConnectionResponse;
import com.eidos.collab.sync.rest.models.HeartbeatResponse;
import com.eidos.collab.sync.rest.models.OpenConnectionRequest;
import com.eidos.collab.sync.rest.models.SnapshotResponse;
import com.eidos.collab.sync.rest.models.ViewRequest;
import com.eidos.collab.sync.stream.HubEventStream;
import com.eidos.collab.util.ExceptionLoggingUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.sse.Sse;
import jakarta.ws.rs.sse.SseEventSink;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;

/**
 * HTTP surface of the synchronization hub. Commands are plain requests; committed changes and
 * presence reach the client through the connection's server-sent event stream.
 */
@Path("/sync")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OntologySyncResource {
    private static final Logger LOG = Logger.getLogger(OntologySyncResource.class);

    @Inject
    SynchronizationHub hub;

    @Inject
    HubEventStream eventStream;

    @Inject
    CallerResolver callerResolver;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    @Inject
    SecurityIdentity identity;

    @Context
    HttpHeaders headers;

    @POST
    @Path("/connections")
    public ConnectionResponse openConnection(OpenConnectionRequest request) {
        String userId = callerResolver.resolve(identity, headers);
        ClientConnection connection = hub.openConnection(userId, request != null ? request.getUserName() : null);
        return new ConnectionResponse(connection.getConnectionId(), connection.getUserId(), connection.getUserName(),
                hub.getSettings().heartbeatInterval().toMillis());
    }

    @DELETE
    @Path("/connections/{connectionId}")
    public Response closeConnection(@PathParam("connectionId") String connectionId) {
        ownedConnection(connectionId);
        hub.disconnect(connectionId);
        return Response.noContent().build();
    }

    @GET
    @Path("/connections/{connectionId}/events")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    public void events(@PathParam("connectionId") String connectionId, SseEventSink eventSink, Sse sse) {
        ClientConnection connection = ownedConnection(connectionId);
        eventStream.events(connection)
                .subscribe().with(
                        event -> {
                            if (!eventSink.isClosed()) {
                                eventSink.send(sse.newEventBuilder()
                                        .name(event.getClass().getSimpleName())
                                        .mediaType(MediaType.APPLICATION_JSON_TYPE)
                                        .data(String.class, toJson(event))
                                        .build());
                            }
                        },
                        failure -> {
                            ExceptionLoggingUtils.logWarn(LOG, failure, "Event stream of connection %s failed",
                                    connectionId);
                            if (!eventSink.isClosed()) {
                                eventSink.close();
                            }
                        },
                        () -> {
                            if (!eventSink.isClosed()) {
                                eventSink.close();
                            }
                        });
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/join")
    public List<PresenceInfo> join(@PathParam("connectionId") String connectionId,
                                   @PathParam("ontologyId") long ontologyId) {
        ownedConnection(connectionId);
        return hub.joinOntology(connectionId, ontologyId);
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/leave")
    public Response leave(@PathParam("connectionId") String connectionId,
                          @PathParam("ontologyId") long ontologyId) {
        ownedConnection(connectionId);
        hub.leaveOntology(connectionId, ontologyId);
        return Response.noContent().build();
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/heartbeat")
    public HeartbeatResponse heartbeat(@PathParam("connectionId") String connectionId,
                                       @PathParam("ontologyId") long ontologyId) {
        ownedConnection(connectionId);
        return new HeartbeatResponse(hub.heartbeat(connectionId, ontologyId), clock.millis());
    }

    @PUT
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/view")
    public Response updateView(@PathParam("connectionId") String connectionId,
                               @PathParam("ontologyId") long ontologyId, ViewRequest request) {
        ownedConnection(connectionId);
        boolean accepted = hub.updateCurrentView(connectionId, ontologyId,
                request != null ? request.getViewName() : null);
        return accepted ? Response.noContent().build() : Response.status(Response.Status.BAD_REQUEST).build();
    }

    @GET
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/snapshot")
    public SnapshotResponse snapshot(@PathParam("connectionId") String connectionId,
                                     @PathParam("ontologyId") long ontologyId) {
        ownedConnection(connectionId);
        return SnapshotResponse.from(hub.snapshot(connectionId, ontologyId));
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/concepts")
    public ConceptChanged changeConcept(@PathParam("connectionId") String connectionId,
                                        @PathParam("ontologyId") long ontologyId, ConceptChange change) {
        ownedConnection(connectionId);
        return hub.proposeConceptChange(connectionId, ontologyId, requireBody(change));
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/relationships")
    public RelationshipChanged changeRelationship(@PathParam("connectionId") String connectionId,
                                                  @PathParam("ontologyId") long ontologyId,
                                                  RelationshipChange change) {
        ownedConnection(connectionId);
        return hub.proposeRelationshipChange(connectionId, ontologyId, requireBody(change));
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/individuals")
    public IndividualChanged changeIndividual(@PathParam("connectionId") String connectionId,
                                              @PathParam("ontologyId") long ontologyId, IndividualChange change) {
        ownedConnection(connectionId);
        return hub.proposeIndividualChange(connectionId, ontologyId, requireBody(change));
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/individual-relationships")
    public IndividualRelationshipChanged changeIndividualRelationship(@PathParam("connectionId") String connectionId,
                                                                      @PathParam("ontologyId") long ontologyId,
                                                                      IndividualRelationshipChange change) {
        ownedConnection(connectionId);
        return hub.proposeIndividualRelationshipChange(connectionId, ontologyId, requireBody(change));
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/groups")
    public GroupChanged changeGroup(@PathParam("connectionId") String connectionId,
                                    @PathParam("ontologyId") long ontologyId, GroupChange change) {
        ownedConnection(connectionId);
        return hub.proposeGroupChange(connectionId, ontologyId, requireBody(change));
    }

    @POST
    @Path("/connections/{connectionId}/ontologies/{ontologyId}/groups/can-create")
    public CanCreateGroupResponse canCreateGroup(@PathParam("connectionId") String connectionId,
                                                 @PathParam("ontologyId") long ontologyId,
                                                 CanCreateGroupRequest request) {
        if (request == null || request.getParentConceptId() == null || request.getChildConceptIds() == null) {
            return new CanCreateGroupResponse(false);
        }
        String userId = callerResolver.resolve(identity, headers);
        boolean owned = hub.findConnection(connectionId)
                .map(connection -> connection.getUserId().equals(userId))
                .orElse(false);
        if (!owned) {
            return new CanCreateGroupResponse(false);
        }
        return new CanCreateGroupResponse(hub.canCreateGroup(connectionId, ontologyId,
                request.getParentConceptId(), request.getChildConceptIds()));
    }

    /**
     * Looks up a connection and checks that it belongs to the caller.
     */
    private ClientConnection ownedConnection(String connectionId) {
        String userId = callerResolver.resolve(identity, headers);
        ClientConnection connection = hub.findConnection(connectionId)
                .orElseThrow(() -> new GraphSyncException(ReasonCode.NOT_FOUND,
                        "Unknown connection " + connectionId));
        if (!connection.getUserId().equals(userId)) {
            LOG.warnf("User %s tried to use connection %s of user %s", userId, connectionId, connection.getUserId());
            throw new GraphSyncException(ReasonCode.PERMISSION_DENIED, "Connection belongs to another user");
        }
        return connection;
    }

    private static <T> T requireBody(T body) {
        if (body == null) {
            throw new GraphSyncException(ReasonCode.INVALID_REQUEST, "Request body is required");
        }
        return body;
    }

    private String toJson(HubEvent event) {
        try {
            return objectMapper.writerFor(HubEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + event.getClass().getSimpleName(), e);
        }
    }
}
