package com.memo.ontology.store;

import static org.junit.jupiter.api.Assertions.*;

import com.memo.ontology.exception.ConflictException;
import com.memo.ontology.exception.InvalidTransitionException;
import com.memo.ontology.exception.NotFoundException;
import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.CreatorType;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeDraft;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeDraft;
import com.memo.ontology.graph.NodePatch;
import com.memo.ontology.graph.NodeQuery;
import com.memo.ontology.graph.NodeType;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.store.memory.InMemoryGraphStore;
import com.memo.ontology.support.TickingClock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OntologyStoreTest {
  private static final String OWNER = "u1";

  private OntologyStore store;

  @BeforeEach
  void setUp() {
    store = new OntologyStore(new InMemoryGraphStore(), new TickingClock(), 3);
  }

  private Node note(String title) {
    return store.createNode(
        OWNER, NodeDraft.builder().title(title).content(title + " body").build(), Actor.user());
  }

  private Node claim(String text) {
    return store.createNode(
        OWNER,
        NodeDraft.builder().title(text).content(text).type(NodeType.CLAIM).build(),
        Actor.user());
  }

  @Test
  @DisplayName("User-created node is Active with manual provenance and a create entry")
  void createNodeByUser() {
    Node n =
        store.createNode(
            OWNER,
            NodeDraft.builder().title("Water").content("Water boils at 100 C").tag("physics").tag("physics").build(),
            Actor.user());

    assertEquals(GovernanceStatus.ACTIVE, n.status());
    assertEquals(CreatorType.USER, n.provenance().creator());
    assertEquals(5, n.wordCount());
    assertEquals(List.of("physics"), n.tags());

    List<ProvenanceLogEntry> entries = store.provenanceFor(OWNER, n.id());
    assertEquals(1, entries.size());
    assertEquals(ProvenanceAction.CREATE, entries.get(0).action());
    assertNotNull(entries.get(0).afterState());
    assertEquals("Water", entries.get(0).afterState().get("title"));
  }

  @Test
  @DisplayName("AI-created node is Experimental even when Active is requested")
  void aiNodeIsExperimental() {
    Node n =
        store.createNode(
            OWNER,
            NodeDraft.builder().title("Claim").status(GovernanceStatus.ACTIVE).build(),
            Actor.ai("gemini-2.5-flash"));

    assertEquals(GovernanceStatus.EXPERIMENTAL, n.status());
    assertEquals("gemini-2.5-flash", n.provenance().model());
    assertEquals(List.of(n), store.listNodes(OWNER, NodeQuery.inbox()));
  }

  @Test
  @DisplayName("Node without title and content is rejected")
  void emptyNodeRejected() {
    assertThrows(
        ValidationException.class,
        () -> store.createNode(OWNER, NodeDraft.builder().title(" ").build(), Actor.user()));
  }

  @Test
  @DisplayName("Nodes cannot be created Deprecated")
  void deprecatedCreationRejected() {
    assertThrows(
        ValidationException.class,
        () ->
            store.createNode(
                OWNER,
                NodeDraft.builder().title("x").status(GovernanceStatus.DEPRECATED).build(),
                Actor.user()));
  }

  @Test
  @DisplayName("Update recomputes word count and logs before and after")
  void updateNode() {
    Node n = note("Draft");
    Node updated =
        store.updateNode(
            OWNER, n.id(), NodePatch.builder().content("one two three").build(), Actor.user());

    assertEquals(3, updated.wordCount());
    assertEquals("Draft", updated.title());
    ProvenanceLogEntry latest = store.provenanceFor(OWNER, n.id()).get(0);
    assertEquals(ProvenanceAction.UPDATE, latest.action());
    assertEquals("Draft body", latest.beforeState().get("content"));
    assertEquals("one two three", latest.afterState().get("content"));
  }

  @Test
  @DisplayName("Self-loop edge is rejected with Validation and nothing is written")
  void selfLoopRejected() {
    Node a = note("A");
    int logSize = store.provenanceLog(OWNER, 0).size();

    ValidationException ex =
        assertThrows(
            ValidationException.class,
            () ->
                store.createEdge(
                    OWNER, EdgeDraft.of(a.id(), a.id(), EdgeType.SUPPORTS, 0.5), Actor.user()));
    assertEquals("no_self_loop", ex.getContext().get("invariant"));
    assertTrue(store.edgesForNode(OWNER, a.id()).isEmpty());
    assertEquals(logSize, store.provenanceLog(OWNER, 0).size());
  }

  @Test
  @DisplayName("Edge weights at the bounds are accepted, outside are rejected")
  void weightBounds() {
    Node a = note("A");
    Node b = note("B");

    assertEquals(
        0.0,
        store.createEdge(OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.SUPPORTS, 0.0), Actor.user())
            .weight());
    assertEquals(
        1.0,
        store.createEdge(OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.DEFINES, 1.0), Actor.user())
            .weight());
    assertThrows(
        ValidationException.class,
        () ->
            store.createEdge(
                OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.PART_OF, -0.01), Actor.user()));
    assertThrows(
        ValidationException.class,
        () ->
            store.createEdge(
                OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.PART_OF, 1.01), Actor.user()));
  }

  @Test
  @DisplayName("Duplicate (source, target, type) is a Conflict, other types and reverse are fine")
  void duplicateEdgeConflict() {
    Node a = note("A");
    Node b = note("B");
    store.createEdge(OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.SUPPORTS, 0.8), Actor.user());

    assertThrows(
        ConflictException.class,
        () ->
            store.createEdge(
                OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.SUPPORTS, 0.3), Actor.user()));
    store.createEdge(OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.REFUTES, 0.3), Actor.user());
    store.createEdge(OWNER, EdgeDraft.of(b.id(), a.id(), EdgeType.SUPPORTS, 0.3), Actor.user());

    assertEquals(3, store.edgesForNode(OWNER, a.id()).size());
  }

  @Test
  @DisplayName("Changing an edge type onto an existing triple is a Conflict")
  void updateEdgeTypeConflict() {
    Node a = note("A");
    Node b = note("B");
    store.createEdge(OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.SUPPORTS, 0.8), Actor.user());
    Edge other =
        store.createEdge(OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.REFUTES, 0.8), Actor.user());

    assertThrows(
        ConflictException.class,
        () -> store.updateEdgeType(OWNER, other.id(), EdgeType.SUPPORTS, Actor.user()));
    assertEquals(
        EdgeType.PART_OF,
        store.updateEdgeType(OWNER, other.id(), EdgeType.PART_OF, Actor.user()).type());
  }

  @Test
  @DisplayName("Edges to unknown or foreign nodes are NotFound")
  void edgeToForeignNode() {
    Node a = note("A");
    Node foreign =
        store.createNode("u2", NodeDraft.builder().title("theirs").build(), Actor.user());

    assertThrows(
        NotFoundException.class,
        () ->
            store.createEdge(
                OWNER, EdgeDraft.of(a.id(), foreign.id(), EdgeType.SUPPORTS, 0.5), Actor.user()));
    assertThrows(NotFoundException.class, () -> store.getNode(OWNER, foreign.id()));
  }

  @Test
  @DisplayName("AI edge starts Experimental; approve is idempotent and logged once")
  void approveIsIdempotent() {
    Node a = note("A");
    Node b = note("B");
    Edge e =
        store.createEdge(
            OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.SUPPORTS, 0.8), Actor.ai("m"));
    assertEquals(GovernanceStatus.EXPERIMENTAL, e.status());

    int before = store.provenanceLog(OWNER, 0).size();
    store.transitionEdgeStatus(OWNER, e.id(), GovernanceStatus.ACTIVE, Actor.user());
    Edge again = store.transitionEdgeStatus(OWNER, e.id(), GovernanceStatus.ACTIVE, Actor.user());

    assertEquals(GovernanceStatus.ACTIVE, again.status());
    List<ProvenanceLogEntry> log = store.provenanceLog(OWNER, 0);
    assertEquals(before + 1, log.size());
    assertEquals(ProvenanceAction.APPROVE, log.get(0).action());
    assertEquals(e.id(), log.get(0).targetEdgeId());
  }

  @Test
  @DisplayName("Deprecated is terminal")
  void deprecatedIsTerminal() {
    Node n = note("A");
    store.transitionNodeStatus(OWNER, n.id(), GovernanceStatus.DEPRECATED, Actor.user());

    assertThrows(
        InvalidTransitionException.class,
        () -> store.transitionNodeStatus(OWNER, n.id(), GovernanceStatus.ACTIVE, Actor.user()));
    int logSize = store.provenanceLog(OWNER, 0).size();
    assertEquals(
        GovernanceStatus.DEPRECATED,
        store.transitionNodeStatus(OWNER, n.id(), GovernanceStatus.DEPRECATED, Actor.user())
            .status());
    assertEquals(logSize, store.provenanceLog(OWNER, 0).size());
    assertEquals(
        1,
        store.provenanceFor(OWNER, n.id()).stream()
            .filter(entry -> entry.action() == ProvenanceAction.DEPRECATE)
            .count());
  }

  @Test
  @DisplayName("A deprecated edge cannot return to Active or Experimental")
  void deprecatedEdgeIsTerminal() {
    Node a = note("A");
    Node b = note("B");
    Edge e =
        store.createEdge(
            OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.SUPPORTS, 0.8), Actor.ai("m"));
    store.transitionEdgeStatus(OWNER, e.id(), GovernanceStatus.DEPRECATED, Actor.user());
    int logSize = store.provenanceLog(OWNER, 0).size();

    assertThrows(
        InvalidTransitionException.class,
        () -> store.transitionEdgeStatus(OWNER, e.id(), GovernanceStatus.ACTIVE, Actor.user()));
    assertThrows(
        InvalidTransitionException.class,
        () ->
            store.transitionEdgeStatus(
                OWNER, e.id(), GovernanceStatus.EXPERIMENTAL, Actor.user()));
    assertEquals(GovernanceStatus.DEPRECATED, store.getEdge(OWNER, e.id()).status());
    assertEquals(logSize, store.provenanceLog(OWNER, 0).size());
  }

  @Test
  @DisplayName("Stored embeddings cannot be changed through the caller's or a reader's array")
  void embeddingIsCopied() {
    Node n = note("A");
    float[] vector = {0.1f, 0.2f, 0.3f};
    store.setEmbedding(OWNER, n.id(), vector);

    vector[0] = 9f;
    store.getNode(OWNER, n.id()).embedding()[1] = -1f;

    assertArrayEquals(new float[] {0.1f, 0.2f, 0.3f}, store.getNode(OWNER, n.id()).embedding());
  }

  @Test
  @DisplayName("Deleting a node cascades its edges and clears log references")
  void deleteCascades() {
    Node a = note("A");
    Node b = note("B");
    Node c = note("C");
    Edge ab =
        store.createEdge(OWNER, EdgeDraft.of(a.id(), b.id(), EdgeType.SUPPORTS, 0.5), Actor.user());
    Edge ca =
        store.createEdge(OWNER, EdgeDraft.of(c.id(), a.id(), EdgeType.DEFINES, 0.5), Actor.user());

    store.deleteNode(OWNER, a.id(), Actor.user());

    assertTrue(store.findNode(OWNER, a.id()).isEmpty());
    assertThrows(NotFoundException.class, () -> store.getEdge(OWNER, ab.id()));
    assertThrows(NotFoundException.class, () -> store.getEdge(OWNER, ca.id()));
    assertTrue(store.edgesForNode(OWNER, b.id()).isEmpty());

    List<ProvenanceLogEntry> log = store.provenanceLog(OWNER, 0);
    for (ProvenanceLogEntry entry : log) {
      assertNotEquals(a.id(), entry.targetNodeId());
      assertNotEquals(ab.id(), entry.targetEdgeId());
      assertNotEquals(ca.id(), entry.targetEdgeId());
    }
    ProvenanceLogEntry delete = log.get(0);
    assertEquals(ProvenanceAction.DELETE, delete.action());
    assertNull(delete.targetNodeId());
    assertEquals(a.id(), delete.metadata().get("deleted_node_id"));
    assertEquals(List.of(ab.id(), ca.id()), delete.metadata().get("cascaded_edge_ids"));
  }

  @Test
  @DisplayName("A failing unit of work leaves no partial writes")
  void failedWriteRollsBack() {
    Node a = note("A");
    int logSize = store.provenanceLog(OWNER, 0).size();

    assertThrows(
        NotFoundException.class,
        () ->
            store.recordActivity(
                OWNER, ProvenanceAction.SUMMARIZE, Actor.ai("m"), "x", "missing", Map.of()));
    assertThrows(
        IllegalStateException.class,
        () ->
            store
                .graph()
                .inTransaction(
                    tx -> {
                      tx.removeNode(OWNER, a.id());
                      throw new IllegalStateException("boom");
                    }));

    assertTrue(store.findNode(OWNER, a.id()).isPresent());
    assertEquals(logSize, store.provenanceLog(OWNER, 0).size());
  }

  @Test
  @DisplayName("Argumentation lists supports first, then refutes, by weight")
  void argumentation() {
    Node claim = claim("Water boils at 100 C at sea level");
    Node weak = note("Anecdote");
    Node strong = note("Measurement");
    Node counter = note("Altitude");
    store.createEdge(
        OWNER, EdgeDraft.of(weak.id(), claim.id(), EdgeType.SUPPORTS, 0.4), Actor.user());
    store.createEdge(
        OWNER, EdgeDraft.of(counter.id(), claim.id(), EdgeType.REFUTES, 0.9), Actor.user());
    store.createEdge(
        OWNER, EdgeDraft.of(strong.id(), claim.id(), EdgeType.SUPPORTS, 0.9), Actor.user());
    store.createEdge(
        OWNER, EdgeDraft.of(claim.id(), weak.id(), EdgeType.RELATED_TO, 1.0), Actor.user());

    List<ArgumentLink> links = store.argumentation(OWNER, claim.id());

    assertEquals(
        List.of(strong.id(), weak.id(), counter.id()),
        links.stream().map(l -> l.counterpart().id()).toList());
    assertThrows(ValidationException.class, () -> store.argumentation(OWNER, weak.id()));
  }

  @Test
  @DisplayName("Embedding must match the configured dimensions")
  void embeddingDimensions() {
    Node n = note("A");
    assertThrows(
        ValidationException.class, () -> store.setEmbedding(OWNER, n.id(), new float[] {1f, 0f}));
    assertTrue(store.setEmbedding(OWNER, n.id(), new float[] {1f, 0f, 0f}).hasEmbedding());
  }

  @Test
  @DisplayName("listNodes filters by status and type, newest first")
  void listNodes() {
    Node first = note("first");
    Node second = claim("second");
    Node third = note("third");

    assertEquals(List.of(third, second, first), store.listNodes(OWNER, NodeQuery.all()));
    assertEquals(
        List.of(second), store.listNodes(OWNER, new NodeQuery(null, NodeType.CLAIM, null, null, 0)));
    assertEquals(
        List.of(third), store.listNodes(OWNER, new NodeQuery(null, null, null, null, 1)));
    assertTrue(store.listNodes("nobody", NodeQuery.all()).isEmpty());
  }
}
