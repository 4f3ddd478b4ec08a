package com.eidos.collab.sync.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Body of every rejected synchronization request.
 */
@Data
@EqualsAndHashCode
@SuperBuilder
@RegisterForReflection
@NoArgsConstructor
@ToString
public class SyncError {
   protected int status;
   protected String reasonCode;
   protected String statusMessage;
   protected String reasonMessage;
   protected boolean retryable;
   protected Long ontologyId;
}
