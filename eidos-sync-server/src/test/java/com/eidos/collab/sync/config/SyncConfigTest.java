package com.eidos.collab.sync.config;

import com.eidos.collab.graph.hub.SyncSettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class SyncConfigTest {

    @Test
    public void settingsCarryEveryMappedValue() {
        SyncSettings settings = new TestSyncConfig(false, null).toSettings();

        assertEquals(Duration.ofMillis(500), settings.lockWait());
        assertEquals(8, settings.outboxCapacity());
        assertEquals(Duration.ofSeconds(30), settings.heartbeatInterval());
        assertEquals(Duration.ofSeconds(60), settings.presenceTimeout());
        assertEquals(20, settings.maxViewNameLength());
        assertEquals(3, settings.grouping().maxDepth());
        assertEquals(200.0, settings.grouping().expansionRadius());
        assertEquals(8, settings.grouping().candidateAngles());
        assertEquals(60.0, settings.grouping().minClearance());
        assertEquals(500.0, settings.grouping().proximityPenalty());
    }
}
