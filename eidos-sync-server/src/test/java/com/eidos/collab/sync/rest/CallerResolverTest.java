package com.eidos.collab.sync.rest;

import com.eidos.collab.graph.exceptions.GraphSyncException;
import com.eidos.collab.graph.exceptions.ReasonCode;
import com.eidos.collab.sync.config.TestSyncConfig;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CallerResolverTest {

    private static final String NO_HEADER = null;

    private static CallerResolver resolver(boolean devIdentity, String defaultUser) {
        CallerResolver resolver = new CallerResolver();
        resolver.config = new TestSyncConfig(devIdentity, defaultUser);
        return resolver;
    }

    @Test
    public void principalWins() {
        assertEquals(Optional.of("alice"), resolver(true, "dev").resolveUserId("alice", "bob"));
        assertEquals(Optional.of("alice"), resolver(false, null).resolveUserId("alice", NO_HEADER));
    }

    @Test
    public void headerIgnoredUnlessEnabled() {
        assertEquals(Optional.empty(), resolver(false, "dev").resolveUserId("", "bob"));
        assertEquals(Optional.of("bob"), resolver(true, null).resolveUserId("", " bob "));
    }

    @Test
    public void defaultUserWhenHeaderMissing() {
        assertEquals(Optional.of("dev"), resolver(true, "dev").resolveUserId("", NO_HEADER));
        assertEquals(Optional.empty(), resolver(true, null).resolveUserId("", "  "));
    }

    @Test
    public void unidentifiedCallerIsDenied() {
        GraphSyncException rejected = assertThrows(GraphSyncException.class,
                () -> resolver(false, null).resolve(null, null));
        assertEquals(ReasonCode.PERMISSION_DENIED, rejected.getReason());
    }
}
