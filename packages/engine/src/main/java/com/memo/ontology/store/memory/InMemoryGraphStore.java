package com.memo.ontology.store.memory;

import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.store.GraphStore;
import com.memo.ontology.store.GraphTransaction;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Heap-backed driver. A read/write lock gives a single writer with concurrent readers; each write
 * keeps an undo log that is replayed in reverse when the unit of work fails.
 */
public class InMemoryGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(InMemoryGraphStore.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final Map<String, Edge> edges = new LinkedHashMap<>();
  private final List<ProvenanceLogEntry> logs = new ArrayList<>();

  @Override
  public void initialize() {
    initialized.set(true);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public <T> T read(Function<GraphTransaction, T> work) {
    lock.readLock().lock();
    try {
      return work.apply(new Tx(null));
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public <T> T inTransaction(Function<GraphTransaction, T> work) {
    lock.writeLock().lock();
    Deque<Runnable> undo = new ArrayDeque<>();
    try {
      return work.apply(new Tx(undo));
    } catch (RuntimeException e) {
      log.debug("Rolling back {} change(s) after failure: {}", undo.size(), e.getMessage());
      while (!undo.isEmpty()) {
        undo.pop().run();
      }
      throw e;
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public String driverId() {
    return InMemoryGraphStoreProvider.ID;
  }

  @Override
  public void shutdown() {
    initialized.set(false);
  }

  private final class Tx implements GraphTransaction {
    private final Deque<Runnable> undo;

    private Tx(Deque<Runnable> undo) {
      this.undo = undo;
    }

    private void checkWritable() {
      if (undo == null) {
        throw new IllegalStateException("Write attempted inside a read-only unit of work");
      }
    }

    @Override
    public Optional<Node> findNode(String ownerId, String nodeId) {
      Node n = nodes.get(nodeId);
      return n != null && n.ownerId().equals(ownerId) ? Optional.of(n) : Optional.empty();
    }

    @Override
    public List<Node> nodes(String ownerId) {
      return nodes.values().stream().filter(n -> n.ownerId().equals(ownerId)).toList();
    }

    @Override
    public void putNode(Node node) {
      checkWritable();
      Node previous = nodes.put(node.id(), node);
      undo.push(
          () -> {
            if (previous == null) nodes.remove(node.id());
            else nodes.put(node.id(), previous);
          });
    }

    @Override
    public void removeNode(String ownerId, String nodeId) {
      checkWritable();
      findNode(ownerId, nodeId)
          .ifPresent(
              existing -> {
                nodes.remove(nodeId);
                undo.push(() -> nodes.put(nodeId, existing));
              });
    }

    @Override
    public Optional<Edge> findEdge(String ownerId, String edgeId) {
      Edge e = edges.get(edgeId);
      return e != null && e.ownerId().equals(ownerId) ? Optional.of(e) : Optional.empty();
    }

    @Override
    public Optional<Edge> findEdge(
        String ownerId, String sourceId, String targetId, EdgeType type) {
      return edges.values().stream()
          .filter(
              e ->
                  e.ownerId().equals(ownerId)
                      && e.sourceId().equals(sourceId)
                      && e.targetId().equals(targetId)
                      && e.type() == type)
          .findFirst();
    }

    @Override
    public List<Edge> edgesTouching(String ownerId, String nodeId) {
      return edges.values().stream()
          .filter(e -> e.ownerId().equals(ownerId) && e.touches(nodeId))
          .toList();
    }

    @Override
    public void putEdge(Edge edge) {
      checkWritable();
      Edge previous = edges.put(edge.id(), edge);
      undo.push(
          () -> {
            if (previous == null) edges.remove(edge.id());
            else edges.put(edge.id(), previous);
          });
    }

    @Override
    public void removeEdge(String ownerId, String edgeId) {
      checkWritable();
      findEdge(ownerId, edgeId)
          .ifPresent(
              existing -> {
                edges.remove(edgeId);
                undo.push(() -> edges.put(edgeId, existing));
              });
    }

    @Override
    public void appendLog(ProvenanceLogEntry entry) {
      checkWritable();
      logs.add(entry);
      int index = logs.size() - 1;
      undo.push(() -> logs.remove(index));
    }

    @Override
    public List<ProvenanceLogEntry> logEntries(String ownerId) {
      return logs.stream().filter(l -> l.ownerId().equals(ownerId)).toList();
    }

    @Override
    public void clearNodeReferences(String ownerId, String nodeId) {
      checkWritable();
      rewriteLogs(
          l -> l.ownerId().equals(ownerId) && nodeId.equals(l.targetNodeId()),
          ProvenanceLogEntry::withoutNodeTarget);
    }

    @Override
    public void clearEdgeReferences(String ownerId, String edgeId) {
      checkWritable();
      rewriteLogs(
          l -> l.ownerId().equals(ownerId) && edgeId.equals(l.targetEdgeId()),
          ProvenanceLogEntry::withoutEdgeTarget);
    }

    private void rewriteLogs(
        java.util.function.Predicate<ProvenanceLogEntry> match,
        Function<ProvenanceLogEntry, ProvenanceLogEntry> rewrite) {
      for (int i = 0; i < logs.size(); i++) {
        ProvenanceLogEntry original = logs.get(i);
        if (match.test(original)) {
          logs.set(i, rewrite.apply(original));
          int index = i;
          undo.push(() -> logs.set(index, original));
        }
      }
    }
  }
}
