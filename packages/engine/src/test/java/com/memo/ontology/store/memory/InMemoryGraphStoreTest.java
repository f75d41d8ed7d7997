package com.memo.ontology.store.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeDraft;
import com.memo.ontology.store.OntologyStore;
import com.memo.ontology.support.TickingClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryGraphStoreTest {

  @Test
  @DisplayName("Read units of work cannot write")
  void readOnlyUnitOfWork() {
    InMemoryGraphStore graph = new InMemoryGraphStore();
    graph.initialize();
    OntologyStore store = new OntologyStore(graph, new TickingClock(), 3);
    Node node = store.createNode("u1", NodeDraft.builder().title("A").build(), Actor.user());

    assertThrows(IllegalStateException.class, () -> graph.read(tx -> {
      tx.removeNode("u1", node.id());
      return null;
    }));
    assertTrue(store.findNode("u1", node.id()).isPresent());
    assertEquals("in-memory", graph.driverId());
  }
}
