package com.eidos.collab.sync.rest.exceptions;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.sync.rest.models.SyncError;
import com.eidos.collab.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps synchronization rejections to HTTP statuses. Rejections are expected client outcomes and
 * are logged at DEBUG, except BUSY which points at contention or a failing store.
 */
@Provider
public class GraphSyncExceptionMapper implements ExceptionMapper<GraphSyncException> {
    private static final Logger LOG = Logger.getLogger(GraphSyncExceptionMapper.class);

    private static final Response.StatusType UNPROCESSABLE_ENTITY = new Response.StatusType() {
        @Override
        public int getStatusCode() {
            return 422;
        }

        @Override
        public Response.Status.Family getFamily() {
            return Response.Status.Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Unprocessable Entity";
        }
    };

    @Override
    public Response toResponse(GraphSyncException exception) {
        ReasonCode reason = exception.getReason();
        Response.StatusType status = statusFor(reason);
        if (reason == ReasonCode.BUSY) {
            ExceptionLoggingUtils.logWarn(LOG, exception, "Ontology %s busy", exception.getOntologyId());
        } else {
            ExceptionLoggingUtils.logDebug(LOG, exception, "Request rejected with %s", reason);
        }

        SyncError error = SyncError.builder()
                .status(status.getStatusCode())
                .reasonCode(reason.name())
                .statusMessage(status.getReasonPhrase())
                .reasonMessage(exception.getMessage())
                .retryable(exception.isRetryable())
                .ontologyId(exception.getOntologyId())
                .build();
        return Response.status(status).entity(error).build();
    }

    public static Response.StatusType statusFor(ReasonCode reason) {
        switch (reason) {
            case PERMISSION_DENIED:
                return Response.Status.FORBIDDEN;
            case NOT_FOUND:
                return Response.Status.NOT_FOUND;
            case STALE_STATE:
            case CONFLICT:
                return Response.Status.CONFLICT;
            case BUSY:
                return Response.Status.SERVICE_UNAVAILABLE;
            default:
                return UNPROCESSABLE_ENTITY;
        }
    }
}
