package com.eidos.collab.sync.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional display name for a new connection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class OpenConnectionRequest {
   private String userName;
}
