package com.memo.ontology.store.orient;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.ConfigurationProvider;
import com.memo.ontology.exception.ConflictException;
import com.memo.ontology.exception.NotFoundException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeDraft;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeDraft;
import com.memo.ontology.graph.NodeType;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.retrieval.RetrievalEngine;
import com.memo.ontology.retrieval.RetrievalSettings;
import com.memo.ontology.store.GraphStore;
import com.memo.ontology.store.GraphStoreFactory;
import com.memo.ontology.store.OntologyStore;
import com.memo.ontology.support.TickingClock;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrientGraphStoreTest {
  private static final String OWNER = "u1";

  private GraphStore graph;
  private OntologyStore store;

  @BeforeEach
  void init() {
    graph =
        GraphStoreFactory.create(
            ConfigurationProvider.fromYaml(
                """
                memo:
                  store:
                    driver: orientdb
                    orientdb:
                      mode: memory
                      database: itest_%s
                """
                    .formatted(UUID.randomUUID().toString().replace("-", ""))));
    store = new OntologyStore(graph, new TickingClock(), 3);
  }

  @AfterEach
  void after() {
    if (graph != null) graph.shutdown();
  }

  private Node node(String title, NodeType type, Actor actor) {
    return store.createNode(
        OWNER,
        NodeDraft.builder().title(title).content(title + " content").type(type).tag("t").build(),
        actor);
  }

  @Test
  @DisplayName("Nodes round-trip through the document store")
  void nodeRoundTrip() {
    assertEquals("orientdb", graph.driverId());
    Node created = node("Water boils", NodeType.CLAIM, Actor.ai("gemini-2.5-flash"));
    store.setEmbedding(OWNER, created.id(), new float[] {0.5f, 0.25f, 0f});

    Node loaded = store.getNode(OWNER, created.id());

    assertEquals(created.title(), loaded.title());
    assertEquals(NodeType.CLAIM, loaded.type());
    assertEquals(GovernanceStatus.EXPERIMENTAL, loaded.status());
    assertEquals("gemini-2.5-flash", loaded.provenance().model());
    assertEquals(List.of("t"), loaded.tags());
    assertArrayEquals(new float[] {0.5f, 0.25f, 0f}, loaded.embedding());
    assertEquals(created.createdAt(), loaded.createdAt());
    assertThrows(NotFoundException.class, () -> store.getNode("u2", created.id()));
  }

  @Test
  @DisplayName("Edge uniqueness, traversal and delete cascade work on OrientDB")
  void edgesAndCascade() {
    Node claim = node("Claim", NodeType.CLAIM, Actor.user());
    Node evidence = node("Evidence", NodeType.EVIDENCE, Actor.user());
    Edge edge =
        store.createEdge(
            OWNER,
            EdgeDraft.of(evidence.id(), claim.id(), EdgeType.SUPPORTS, 0.9).withLabel("backs"),
            Actor.user());

    assertThrows(
        ConflictException.class,
        () ->
            store.createEdge(
                OWNER,
                EdgeDraft.of(evidence.id(), claim.id(), EdgeType.SUPPORTS, 0.1),
                Actor.user()));

    RetrievalEngine retrieval = new RetrievalEngine(graph, RetrievalSettings.defaults());
    var context = retrieval.neighborContext(claim.id(), OWNER, 1);
    assertEquals(1, context.size());
    assertEquals(evidence.id(), context.get(0).node().id());
    assertEquals(0.9, context.get(0).weight());

    store.deleteNode(OWNER, claim.id(), Actor.user());

    assertThrows(NotFoundException.class, () -> store.getEdge(OWNER, edge.id()));
    List<ProvenanceLogEntry> log = store.provenanceLog(OWNER, 0);
    assertEquals(ProvenanceAction.DELETE, log.get(0).action());
    assertEquals(List.of(edge.id()), log.get(0).metadata().get("cascaded_edge_ids"));
    assertTrue(log.stream().noneMatch(e -> claim.id().equals(e.targetNodeId())));
    assertTrue(log.stream().noneMatch(e -> edge.id().equals(e.targetEdgeId())));
  }

  @Test
  @DisplayName("Log entries keep append order and failed units of work roll back")
  void logOrderAndRollback() {
    Node a = node("A", NodeType.NOTE, Actor.ai("m"));
    store.transitionNodeStatus(OWNER, a.id(), GovernanceStatus.ACTIVE, Actor.user());

    assertThrows(
        IllegalStateException.class,
        () ->
            graph.inTransaction(
                tx -> {
                  tx.removeNode(OWNER, a.id());
                  throw new IllegalStateException("boom");
                }));

    assertTrue(store.findNode(OWNER, a.id()).isPresent());
    List<ProvenanceAction> actions =
        store.provenanceLog(OWNER, 0).stream().map(ProvenanceLogEntry::action).toList();
    assertEquals(List.of(ProvenanceAction.APPROVE, ProvenanceAction.CREATE), actions);
  }
}
