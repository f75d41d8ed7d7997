package com.memo.ontology.store;

import com.memo.ontology.exception.ConflictException;
import com.memo.ontology.exception.NotFoundException;
import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Actor;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeDraft;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeDraft;
import com.memo.ontology.graph.NodePatch;
import com.memo.ontology.graph.NodeQuery;
import com.memo.ontology.graph.NodeType;
import com.memo.ontology.graph.Provenance;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.graph.ProvenanceMethod;
import com.memo.ontology.utility.JacksonUtility;
import com.memo.ontology.utility.StringUtility;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Canonical graph of nodes and edges plus the append-only provenance ledger.
 *
 * <p>Every mutation runs as one unit of work on the underlying {@link GraphStore}: all invariant
 * checks happen first, then the entity write and its audit entry are applied together. Lookups of
 * another owner's rows report {@link NotFoundException} exactly as unknown ids do.
 */
public class OntologyStore {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(OntologyStore.class);

  private final GraphStore graph;
  private final Clock clock;
  private final int embeddingDimensions;

  public OntologyStore(GraphStore graph, Clock clock, int embeddingDimensions) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (embeddingDimensions <= 0) {
      throw new ValidationException("Embedding dimensions must be positive");
    }
    this.embeddingDimensions = embeddingDimensions;
  }

  public GraphStore graph() {
    return graph;
  }

  public int embeddingDimensions() {
    return embeddingDimensions;
  }

  // ---------------------------------------------------------------- nodes

  /**
   * Creates a node and its {@code create} audit entry.
   *
   * <p>AI actors always produce Experimental nodes; users get Active unless the draft asks for
   * Experimental. Deprecated is never accepted at creation.
   */
  public Node createNode(String ownerId, NodeDraft draft, Actor actor) {
    requireOwner(ownerId);
    Objects.requireNonNull(draft, "draft");
    Objects.requireNonNull(actor, "actor");

    String title = draft.title() == null ? "" : draft.title();
    String content = draft.content() == null ? "" : draft.content();
    if (title.isBlank() && content.isBlank()) {
      throw new ValidationException(
          "A node needs a title or content", Map.of("field", "title", "invariant", "non_empty"));
    }
    GovernanceStatus status = initialStatus(actor, draft.requestedStatus());
    ProvenanceMethod method = draft.method() != null ? draft.method() : ProvenanceMethod.MANUAL;
    Provenance provenance =
        Provenance.of(actor, method, draft.sourceNodeId(), draft.confidence());
    NodeType type = draft.type() != null ? draft.type() : NodeType.NOTE;

    Instant now = clock.instant();
    Node node =
        new Node(
            newId(),
            ownerId,
            draft.folderId(),
            title,
            content,
            type,
            status,
            provenance,
            null,
            distinct(draft.tags()),
            StringUtility.wordCount(content),
            now,
            now);

    return graph.inTransaction(
        tx -> {
          tx.putNode(node);
          tx.appendLog(
              entry(ownerId, ProvenanceAction.CREATE, actor, "Created " + describe(node))
                  .targetNode(node.id())
                  .after(snapshot(node))
                  .build(now));
          log.debug("Created node {} for owner {}", node.id(), ownerId);
          return node;
        });
  }

  private static GovernanceStatus initialStatus(Actor actor, GovernanceStatus requested) {
    if (requested == GovernanceStatus.DEPRECATED) {
      throw new ValidationException(
          "Entities cannot be created Deprecated", Map.of("field", "status"));
    }
    if (actor.isAi()) {
      return GovernanceStatus.EXPERIMENTAL;
    }
    return requested != null ? requested : GovernanceStatus.ACTIVE;
  }

  /** Applies the non-null fields of the patch; word count follows the content. */
  public Node updateNode(String ownerId, String nodeId, NodePatch patch, Actor actor) {
    requireOwner(ownerId);
    Objects.requireNonNull(patch, "patch");
    if (patch.isEmpty()) {
      throw new ValidationException("Node update carries no changes", Map.of("node_id", nodeId));
    }

    return graph.inTransaction(
        tx -> {
          Node before = requireNode(tx, ownerId, nodeId);
          String title = patch.title() != null ? patch.title() : before.title();
          String content = patch.content() != null ? patch.content() : before.content();
          if (title.isBlank() && content.isBlank()) {
            throw new ValidationException(
                "A node needs a title or content",
                Map.of("field", "title", "invariant", "non_empty"));
          }
          String folderId =
              patch.clearFolder()
                  ? null
                  : patch.folderId() != null ? patch.folderId() : before.folderId();
          Instant now = clock.instant();
          Node after =
              before.withFields(
                  title,
                  content,
                  patch.type() != null ? patch.type() : before.type(),
                  folderId,
                  patch.tags() != null ? distinct(patch.tags()) : before.tags(),
                  StringUtility.wordCount(content),
                  now);
          tx.putNode(after);
          tx.appendLog(
              entry(ownerId, ProvenanceAction.UPDATE, actor, "Updated " + describe(after))
                  .targetNode(nodeId)
                  .before(snapshot(before))
                  .after(snapshot(after))
                  .build(now));
          return after;
        });
  }

  /**
   * Moves a node through the governance lifecycle.
   *
   * @return the node after the move; unchanged, with no audit entry, when it already sits in the
   *     requested state of a legal action
   */
  public Node transitionNodeStatus(
      String ownerId, String nodeId, GovernanceStatus target, Actor actor) {
    requireOwner(ownerId);
    Objects.requireNonNull(target, "target");

    return graph.inTransaction(
        tx -> {
          Node before = requireNode(tx, ownerId, nodeId);
          Optional<ProvenanceAction> action = before.status().transitionTo(target);
          if (action.isEmpty()) {
            log.debug("Node {} already {}, nothing to do", nodeId, target.wireName());
            return before;
          }
          Instant now = clock.instant();
          Node after = before.withStatus(target, now);
          tx.putNode(after);
          tx.appendLog(
              entry(
                      ownerId,
                      action.get(),
                      actor,
                      "%s -> %s: %s"
                          .formatted(
                              before.status().wireName(), target.wireName(), describe(after)))
                  .targetNode(nodeId)
                  .before(snapshot(before))
                  .after(snapshot(after))
                  .build(now));
          return after;
        });
  }

  /**
   * Deletes a node, every edge touching it, and nulls log references to all of them. The {@code
   * delete} entry lists the cascaded edge ids and carries no target.
   */
  public void deleteNode(String ownerId, String nodeId, Actor actor) {
    requireOwner(ownerId);
    graph.inTransaction(
        tx -> {
          Node before = requireNode(tx, ownerId, nodeId);
          List<String> cascaded = new ArrayList<>();
          for (Edge edge : tx.edgesTouching(ownerId, nodeId)) {
            tx.removeEdge(ownerId, edge.id());
            tx.clearEdgeReferences(ownerId, edge.id());
            cascaded.add(edge.id());
          }
          tx.removeNode(ownerId, nodeId);
          tx.clearNodeReferences(ownerId, nodeId);

          Map<String, Object> metadata = new LinkedHashMap<>();
          metadata.put("deleted_node_id", nodeId);
          metadata.put("cascaded_edge_ids", cascaded);
          tx.appendLog(
              entry(ownerId, ProvenanceAction.DELETE, actor, "Deleted " + describe(before))
                  .before(snapshot(before))
                  .metadata(metadata)
                  .build(clock.instant()));
          log.debug("Deleted node {} with {} edge(s)", nodeId, cascaded.size());
          return null;
        });
  }

  /** Stores a derived embedding vector; not audited. */
  public Node setEmbedding(String ownerId, String nodeId, float[] vector) {
    requireOwner(ownerId);
    if (vector == null || vector.length != embeddingDimensions) {
      throw new ValidationException(
          "Embedding must have %d dimensions, got %d"
              .formatted(embeddingDimensions, vector == null ? 0 : vector.length),
          Map.of("field", "embedding", "expected", embeddingDimensions));
    }
    float[] copy = vector.clone();
    return graph.inTransaction(
        tx -> {
          Node after = requireNode(tx, ownerId, nodeId).withEmbedding(copy, clock.instant());
          tx.putNode(after);
          return after;
        });
  }

  // ---------------------------------------------------------------- edges

  /** Creates an edge; AI actors produce Experimental edges. */
  public Edge createEdge(String ownerId, EdgeDraft draft, Actor actor) {
    requireOwner(ownerId);
    Objects.requireNonNull(draft, "draft");
    Objects.requireNonNull(actor, "actor");

    if (draft.sourceId() == null || draft.targetId() == null) {
      throw new ValidationException("Edge endpoints are required", Map.of("field", "source_id"));
    }
    if (draft.sourceId().equals(draft.targetId())) {
      throw new ValidationException(
          "Edge cannot connect a node to itself",
          Map.of("field", "target_id", "invariant", "no_self_loop", "node_id", draft.sourceId()));
    }
    double weight = draft.effectiveWeight();
    checkWeight(weight);
    EdgeType type = draft.effectiveType();
    ProvenanceMethod method = draft.method() != null ? draft.method() : ProvenanceMethod.MANUAL;
    Provenance provenance =
        Provenance.of(actor, method, draft.sourceNodeId(), draft.confidence());
    GovernanceStatus status = actor.isAi() ? GovernanceStatus.EXPERIMENTAL : GovernanceStatus.ACTIVE;

    return graph.inTransaction(
        tx -> {
          Node source = requireNode(tx, ownerId, draft.sourceId());
          Node target = requireNode(tx, ownerId, draft.targetId());
          checkUnique(tx, ownerId, source.id(), target.id(), type, null);

          Instant now = clock.instant();
          Edge edge =
              new Edge(
                  newId(),
                  ownerId,
                  source.id(),
                  target.id(),
                  type,
                  status,
                  weight,
                  draft.label(),
                  provenance,
                  now,
                  now);
          tx.putEdge(edge);
          tx.appendLog(
              entry(
                      ownerId,
                      ProvenanceAction.CREATE,
                      actor,
                      "Linked %s -[%s]-> %s"
                          .formatted(source.title(), type.wireName(), target.title()))
                  .targetEdge(edge.id())
                  .after(snapshot(edge))
                  .build(now));
          return edge;
        });
  }

  /** Changes the edge type in place, re-checking the (owner, source, target, type) uniqueness. */
  public Edge updateEdgeType(String ownerId, String edgeId, EdgeType newType, Actor actor) {
    requireOwner(ownerId);
    Objects.requireNonNull(newType, "newType");
    return graph.inTransaction(
        tx -> {
          Edge before = requireEdge(tx, ownerId, edgeId);
          if (before.type() == newType) {
            return before;
          }
          checkUnique(tx, ownerId, before.sourceId(), before.targetId(), newType, edgeId);
          Instant now = clock.instant();
          Edge after = before.withType(newType, now);
          tx.putEdge(after);
          tx.appendLog(
              entry(
                      ownerId,
                      ProvenanceAction.UPDATE,
                      actor,
                      "Edge type %s -> %s"
                          .formatted(before.type().wireName(), newType.wireName()))
                  .targetEdge(edgeId)
                  .before(snapshot(before))
                  .after(snapshot(after))
                  .build(now));
          return after;
        });
  }

  /** Edge counterpart of {@link #transitionNodeStatus}. */
  public Edge transitionEdgeStatus(
      String ownerId, String edgeId, GovernanceStatus target, Actor actor) {
    requireOwner(ownerId);
    Objects.requireNonNull(target, "target");
    return graph.inTransaction(
        tx -> {
          Edge before = requireEdge(tx, ownerId, edgeId);
          Optional<ProvenanceAction> action = before.status().transitionTo(target);
          if (action.isEmpty()) {
            return before;
          }
          Instant now = clock.instant();
          Edge after = before.withStatus(target, now);
          tx.putEdge(after);
          tx.appendLog(
              entry(
                      ownerId,
                      action.get(),
                      actor,
                      "Edge %s -> %s"
                          .formatted(before.status().wireName(), target.wireName()))
                  .targetEdge(edgeId)
                  .before(snapshot(before))
                  .after(snapshot(after))
                  .build(now));
          return after;
        });
  }

  public void deleteEdge(String ownerId, String edgeId, Actor actor) {
    requireOwner(ownerId);
    graph.inTransaction(
        tx -> {
          Edge before = requireEdge(tx, ownerId, edgeId);
          tx.removeEdge(ownerId, edgeId);
          tx.clearEdgeReferences(ownerId, edgeId);
          tx.appendLog(
              entry(ownerId, ProvenanceAction.DELETE, actor, "Deleted edge " + edgeId)
                  .before(snapshot(before))
                  .metadata(Map.of("deleted_edge_id", edgeId))
                  .build(clock.instant()));
          return null;
        });
  }

  private static void checkWeight(double weight) {
    if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
      throw new ValidationException(
          "Edge weight must be within [0, 1], got " + weight,
          Map.of("field", "weight", "value", weight));
    }
  }

  private static void checkUnique(
      GraphTransaction tx,
      String ownerId,
      String sourceId,
      String targetId,
      EdgeType type,
      String ignoreEdgeId) {
    Optional<Edge> existing = tx.findEdge(ownerId, sourceId, targetId, type);
    if (existing.isPresent() && !existing.get().id().equals(ignoreEdgeId)) {
      throw new ConflictException(
          "Edge %s -[%s]-> %s already exists".formatted(sourceId, type.wireName(), targetId),
          Map.of("existing_edge_id", existing.get().id(), "type", type.wireName()));
    }
  }

  // ---------------------------------------------------------------- audit

  /**
   * Appends a free-standing audit entry for pipeline activity (extraction, summaries, link
   * suggestions). A target node, when given, must exist.
   */
  public ProvenanceLogEntry recordActivity(
      String ownerId,
      ProvenanceAction action,
      Actor actor,
      String description,
      String targetNodeId,
      Map<String, Object> metadata) {
    requireOwner(ownerId);
    return graph.inTransaction(
        tx -> {
          if (targetNodeId != null) {
            requireNode(tx, ownerId, targetNodeId);
          }
          ProvenanceLogEntry e =
              entry(ownerId, action, actor, description)
                  .targetNode(targetNodeId)
                  .metadata(metadata)
                  .build(clock.instant());
          tx.appendLog(e);
          return e;
        });
  }

  // ---------------------------------------------------------------- reads

  public Node getNode(String ownerId, String nodeId) {
    return graph.read(tx -> requireNode(tx, ownerId, nodeId));
  }

  public Optional<Node> findNode(String ownerId, String nodeId) {
    return graph.read(tx -> tx.findNode(ownerId, nodeId));
  }

  public Edge getEdge(String ownerId, String edgeId) {
    return graph.read(tx -> requireEdge(tx, ownerId, edgeId));
  }

  /** Matching nodes, newest first. The review inbox is {@link NodeQuery#inbox()}. */
  public List<Node> listNodes(String ownerId, NodeQuery query) {
    NodeQuery q = query != null ? query : NodeQuery.all();
    List<Node> result =
        graph.read(
            tx ->
                tx.nodes(ownerId).stream()
                    .filter(q::matches)
                    .sorted(
                        Comparator.comparing(Node::createdAt)
                            .reversed()
                            .thenComparing(Node::id))
                    .toList());
    return q.limit() > 0 && result.size() > q.limit() ? result.subList(0, q.limit()) : result;
  }

  /** Non-deprecated edges touching the node. */
  public List<Edge> edgesForNode(String ownerId, String nodeId) {
    return graph.read(
        tx -> {
          requireNode(tx, ownerId, nodeId);
          return tx.edgesTouching(ownerId, nodeId).stream()
              .filter(e -> e.status() != GovernanceStatus.DEPRECATED)
              .sorted(Comparator.comparing(Edge::createdAt).thenComparing(Edge::id))
              .toList();
        });
  }

  /**
   * Supports and refutes edges around a claim with the node on the other side, supporting links
   * first, then by weight descending.
   */
  public List<ArgumentLink> argumentation(String ownerId, String claimId) {
    return graph.read(
        tx -> {
          Node claim = requireNode(tx, ownerId, claimId);
          if (claim.type() != NodeType.CLAIM) {
            throw new ValidationException(
                "Argumentation is only defined for Claim nodes",
                Map.of("node_id", claimId, "type", claim.type().wireName()));
          }
          List<ArgumentLink> links = new ArrayList<>();
          for (Edge edge : tx.edgesTouching(ownerId, claimId)) {
            if (edge.status() == GovernanceStatus.DEPRECATED) continue;
            if (edge.type() != EdgeType.SUPPORTS && edge.type() != EdgeType.REFUTES) continue;
            tx.findNode(ownerId, edge.otherEnd(claimId))
                .ifPresent(
                    other ->
                        links.add(
                            new ArgumentLink(edge, other, edge.sourceId().equals(claimId))));
          }
          links.sort(
              Comparator.comparing((ArgumentLink l) -> !l.supporting())
                  .thenComparing(
                      Comparator.comparingDouble((ArgumentLink l) -> l.edge().weight())
                          .reversed())
                  .thenComparing(l -> l.edge().id()));
          return links;
        });
  }

  /** Audit entries that still reference the node, newest first. */
  public List<ProvenanceLogEntry> provenanceFor(String ownerId, String nodeId) {
    return graph.read(
        tx -> {
          List<ProvenanceLogEntry> entries =
              new ArrayList<>(
                  tx.logEntries(ownerId).stream()
                      .filter(e -> nodeId.equals(e.targetNodeId()))
                      .toList());
          Collections.reverse(entries);
          return entries;
        });
  }

  /** The owner's audit log, newest first, capped at {@code limit} when positive. */
  public List<ProvenanceLogEntry> provenanceLog(String ownerId, int limit) {
    return graph.read(
        tx -> {
          List<ProvenanceLogEntry> entries = new ArrayList<>(tx.logEntries(ownerId));
          Collections.reverse(entries);
          return limit > 0 && entries.size() > limit
              ? List.copyOf(entries.subList(0, limit))
              : entries;
        });
  }

  // ---------------------------------------------------------------- helpers

  private static Node requireNode(GraphTransaction tx, String ownerId, String nodeId) {
    if (nodeId == null) {
      throw new ValidationException("Node id is required", Map.of("field", "node_id"));
    }
    return tx.findNode(ownerId, nodeId)
        .orElseThrow(
            () -> new NotFoundException("Node not found: " + nodeId, Map.of("node_id", nodeId)));
  }

  private static Edge requireEdge(GraphTransaction tx, String ownerId, String edgeId) {
    if (edgeId == null) {
      throw new ValidationException("Edge id is required", Map.of("field", "edge_id"));
    }
    return tx.findEdge(ownerId, edgeId)
        .orElseThrow(
            () -> new NotFoundException("Edge not found: " + edgeId, Map.of("edge_id", edgeId)));
  }

  /** Rejects a missing tenant id before any read or write. */
  public static void requireOwner(String ownerId) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new ValidationException("Owner id is required", Map.of("field", "owner_id"));
    }
  }

  private static List<String> distinct(List<String> tags) {
    if (tags == null) return List.of();
    LinkedHashSet<String> set = new LinkedHashSet<>();
    for (String t : tags) {
      if (t != null && !t.isBlank()) set.add(t.trim());
    }
    return List.copyOf(set);
  }

  private static String describe(Node node) {
    return "%s \"%s\"".formatted(node.type().wireName(), StringUtility.truncate(node.title(), 80));
  }

  private static Map<String, Object> snapshot(Object entity) {
    return JacksonUtility.toMap(entity);
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }

  private static EntryBuilder entry(
      String ownerId, ProvenanceAction action, Actor actor, String description) {
    return new EntryBuilder(ownerId, action, actor, description);
  }

  private static final class EntryBuilder {
    private final String ownerId;
    private final ProvenanceAction action;
    private final Actor actor;
    private final String description;
    private String targetNodeId;
    private String targetEdgeId;
    private Map<String, Object> before;
    private Map<String, Object> after;
    private Map<String, Object> metadata = Map.of();

    private EntryBuilder(
        String ownerId, ProvenanceAction action, Actor actor, String description) {
      this.ownerId = ownerId;
      this.action = action;
      this.actor = Objects.requireNonNull(actor, "actor");
      this.description = description;
    }

    EntryBuilder targetNode(String id) {
      this.targetNodeId = id;
      return this;
    }

    EntryBuilder targetEdge(String id) {
      this.targetEdgeId = id;
      return this;
    }

    EntryBuilder before(Map<String, Object> state) {
      this.before = state;
      return this;
    }

    EntryBuilder after(Map<String, Object> state) {
      this.after = state;
      return this;
    }

    EntryBuilder metadata(Map<String, Object> values) {
      this.metadata = values == null ? Map.of() : values;
      return this;
    }

    ProvenanceLogEntry build(Instant now) {
      return new ProvenanceLogEntry(
          newId(),
          ownerId,
          action,
          description,
          actor.creator(),
          actor.modelId(),
          actor.modelVersion(),
          targetNodeId,
          targetEdgeId,
          before,
          after,
          metadata,
          now);
    }
  }
}
