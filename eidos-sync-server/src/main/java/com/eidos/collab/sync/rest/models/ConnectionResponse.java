package com.eidos.collab.sync.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class ConnectionResponse {
   private String connectionId;
   private String userId;
   private String userName;
   private long heartbeatIntervalMillis;
}
