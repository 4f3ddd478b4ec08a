package com.eidos.collab.sync.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Whether the heartbeat refreshed a joined connection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class HeartbeatResponse {
   private boolean accepted;
   private long serverTime;
}
