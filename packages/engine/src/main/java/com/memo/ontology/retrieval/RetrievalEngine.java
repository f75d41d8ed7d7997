package com.memo.ontology.retrieval;

import com.memo.ontology.exception.ValidationException;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.store.GraphStore;
import com.memo.ontology.store.GraphTransaction;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only retrieval primitives over an owner's graph: vector search, trigram text search and
 * bounded neighbor traversal. Callers combine the primitives; this class never merges them.
 */
public class RetrievalEngine {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(RetrievalEngine.class);

  private final GraphStore graph;
  private final RetrievalSettings settings;

  public RetrievalEngine(GraphStore graph, RetrievalSettings settings) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public RetrievalSettings settings() {
    return settings;
  }

  public List<ScoredNode> searchByVector(String ownerId, float[] query) {
    return searchByVector(ownerId, query, settings.vectorThreshold(), settings.vectorLimit());
  }

  /**
   * Nodes whose cosine similarity to {@code query} is strictly above {@code threshold}. Deprecated
   * nodes and nodes without an embedding never match.
   */
  public List<ScoredNode> searchByVector(
      String ownerId, float[] query, double threshold, int limit) {
    if (query == null || query.length == 0) {
      throw new ValidationException("Query vector is required", Map.of("field", "vector"));
    }
    List<ScoredNode> hits =
        graph.read(
            tx -> {
              List<ScoredNode> out = new ArrayList<>();
              for (Node n : tx.nodes(ownerId)) {
                if (n.status() == GovernanceStatus.DEPRECATED || !n.hasEmbedding()) continue;
                float[] embedding = n.embedding();
                if (embedding.length != query.length) {
                  log.warn(
                      "Skipping node {}: embedding has {} dimensions, query has {}",
                      n.id(),
                      embedding.length,
                      query.length);
                  continue;
                }
                double sim = VectorMath.cosine(query, embedding);
                if (sim > threshold) out.add(new ScoredNode(n, sim));
              }
              return out;
            });
    return rank(hits, limit);
  }

  public List<ScoredNode> searchByText(String ownerId, String text) {
    return searchByText(ownerId, text, settings.textLimit());
  }

  /**
   * Fuzzy lexical search. Rank is the larger of the title and content trigram similarity; a row
   * matches when either reaches the configured match threshold.
   */
  public List<ScoredNode> searchByText(String ownerId, String text, int limit) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("Search text is required", Map.of("field", "text"));
    }
    Set<String> queryTrigrams = TrigramSimilarity.trigrams(text);
    double matchThreshold = settings.textMatchThreshold();
    List<ScoredNode> hits =
        graph.read(
            tx -> {
              List<ScoredNode> out = new ArrayList<>();
              for (Node n : tx.nodes(ownerId)) {
                if (n.status() == GovernanceStatus.DEPRECATED) continue;
                double titleSim =
                    TrigramSimilarity.similarity(TrigramSimilarity.trigrams(n.title()), queryTrigrams);
                double contentSim =
                    TrigramSimilarity.similarity(
                        TrigramSimilarity.trigrams(n.content()), queryTrigrams);
                if (titleSim >= matchThreshold || contentSim >= matchThreshold) {
                  out.add(new ScoredNode(n, Math.max(titleSim, contentSim)));
                }
              }
              return out;
            });
    return rank(hits, limit);
  }

  private static List<ScoredNode> rank(List<ScoredNode> hits, int limit) {
    return hits.stream()
        .sorted(ScoredNode.RANKING)
        .limit(limit > 0 ? limit : Long.MAX_VALUE)
        .toList();
  }

  public List<NeighborContext> neighborContext(String nodeId, String ownerId) {
    return neighborContext(nodeId, ownerId, settings.defaultDepth());
  }

  /**
   * Breadth-first walk of the undirected adjacency up to {@code depth} hops.
   *
   * <p>The visited set is seeded with the origin, so the origin is never reported and each node is
   * reported once, through the first edge that reaches it. Deprecated edges are ignored and
   * Deprecated nodes are neither reported nor expanded. Edges of a node are visited in creation
   * order, so results are deterministic.
   */
  public List<NeighborContext> neighborContext(String nodeId, String ownerId, int depth) {
    if (depth < 1) {
      throw new ValidationException("Traversal depth must be at least 1", Map.of("depth", depth));
    }
    return graph.read(
        tx -> {
          List<NeighborContext> result = new ArrayList<>();
          if (tx.findNode(ownerId, nodeId).isEmpty()) return result;

          Set<String> visited = new HashSet<>();
          visited.add(nodeId);
          List<String> frontier = List.of(nodeId);
          for (int d = 1; d <= depth && !frontier.isEmpty(); d++) {
            List<String> next = new ArrayList<>();
            for (String current : frontier) {
              for (Edge edge : orderedEdges(tx, ownerId, current)) {
                String other = edge.otherEnd(current);
                if (!visited.add(other)) continue;
                Optional<Node> neighbor = tx.findNode(ownerId, other);
                if (neighbor.isEmpty()
                    || neighbor.get().status() == GovernanceStatus.DEPRECATED) {
                  continue;
                }
                Direction dir =
                    edge.sourceId().equals(current) ? Direction.OUTGOING : Direction.INCOMING;
                result.add(
                    new NeighborContext(
                        neighbor.get(), edge.id(), edge.type(), edge.weight(), dir, d));
                next.add(other);
              }
            }
            frontier = next;
          }
          return result;
        });
  }

  private static List<Edge> orderedEdges(GraphTransaction tx, String ownerId, String nodeId) {
    return tx.edgesTouching(ownerId, nodeId).stream()
        .filter(e -> e.status() != GovernanceStatus.DEPRECATED)
        .sorted(Comparator.comparing(Edge::createdAt).thenComparing(Edge::id))
        .toList();
  }
}
