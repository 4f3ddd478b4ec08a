package com.eidos.collab.sync.rest;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.sync.config.SyncConfig;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;

import java.util.Optional;

/**
 * Resolves the user behind a request. Authenticated callers are identified by their principal;
 * anonymous callers only when the development identity header is enabled.
 */
@ApplicationScoped
public class CallerResolver {

    @Inject
    SyncConfig config;

    public String resolve(SecurityIdentity identity, HttpHeaders headers) {
        return resolveUserId(identity, headers)
                .orElseThrow(() -> new GraphSyncException(ReasonCode.PERMISSION_DENIED, "Caller is not identified"));
    }

    Optional<String> resolveUserId(SecurityIdentity identity, HttpHeaders headers) {
        String principal = identity != null && !identity.isAnonymous() && identity.getPrincipal() != null
                ? identity.getPrincipal().getName() : null;
        String header = headers != null ? headers.getHeaderString(config.devIdentity().headerName()) : null;
        return resolveUserId(principal, header);
    }

    Optional<String> resolveUserId(String principal, String devHeader) {
        if (principal != null && !principal.isBlank()) {
            return Optional.of(principal);
        }
        SyncConfig.DevIdentity dev = config.devIdentity();
        if (!dev.enabled()) {
            return Optional.empty();
        }
        if (devHeader != null && !devHeader.isBlank()) {
            return Optional.of(devHeader.trim());
        }
        return dev.defaultUser().filter(user -> !user.isBlank());
    }
}
