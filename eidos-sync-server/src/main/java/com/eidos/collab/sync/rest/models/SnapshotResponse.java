package com.eidos.collab.sync.rest.models;

import com.eidos.collab.graph.grouping.VisibleGraph;
import com.eidos.collab.graph.hub.HubSnapshot;
import com.eidos.collab.graph.model.Concept;
import com.eidos.collab.graph.model.ConceptGroup;
import com.eidos.collab.graph.model.Individual;
import com.eidos.collab.graph.model.IndividualRelationship;
import com.eidos.collab.graph.model.Relationship;
import com.eidos.collab.graph.store.GraphSnapshot;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full graph of an ontology with its projection, as sent on join and after a resync.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class SnapshotResponse {
   private long ontologyId;
   private long revision;
   private List<Concept> concepts;
   private List<Relationship> relationships;
   private List<Individual> individuals;
   private List<IndividualRelationship> individualRelationships;
   private List<ConceptGroup> groups;
   private VisibleGraph visibleGraph;

   public static SnapshotResponse from(HubSnapshot hubSnapshot) {
      GraphSnapshot snapshot = hubSnapshot.snapshot();
      return new SnapshotResponse(snapshot.ontologyId(), snapshot.revision(), List.copyOf(snapshot.concepts()),
              List.copyOf(snapshot.relationships()), List.copyOf(snapshot.individuals()),
              List.copyOf(snapshot.individualRelationships()), List.copyOf(snapshot.groups()),
              hubSnapshot.visibleGraph());
   }
}
