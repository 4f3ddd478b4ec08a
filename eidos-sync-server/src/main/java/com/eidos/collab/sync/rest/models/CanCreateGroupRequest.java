package com.eidos.collab.sync.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class CanCreateGroupRequest {
   private Long parentConceptId;
   private List<Long> childConceptIds;
}
