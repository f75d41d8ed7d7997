package com.memo.ontology.store.orient;

import com.fasterxml.jackson.core.type.TypeReference;
import com.memo.ontology.exception.SerializationException;
import com.memo.ontology.exception.StoreException;
import com.memo.ontology.graph.CreatorType;
import com.memo.ontology.graph.Edge;
import com.memo.ontology.graph.EdgeType;
import com.memo.ontology.graph.GovernanceStatus;
import com.memo.ontology.graph.Node;
import com.memo.ontology.graph.NodeType;
import com.memo.ontology.graph.Provenance;
import com.memo.ontology.graph.ProvenanceAction;
import com.memo.ontology.graph.ProvenanceLogEntry;
import com.memo.ontology.store.GraphStore;
import com.memo.ontology.store.GraphTransaction;
import com.memo.ontology.utility.JacksonUtility;
import com.orientechnologies.orient.core.config.OGlobalConfiguration;
import com.orientechnologies.orient.core.db.ODatabasePool;
import com.orientechnologies.orient.core.db.ODatabaseSession;
import com.orientechnologies.orient.core.db.ODatabaseType;
import com.orientechnologies.orient.core.db.OrientDB;
import com.orientechnologies.orient.core.db.OrientDBConfig;
import com.orientechnologies.orient.core.metadata.schema.OClass;
import com.orientechnologies.orient.core.metadata.schema.OSchema;
import com.orientechnologies.orient.core.metadata.schema.OType;
import com.orientechnologies.orient.core.record.OElement;
import com.orientechnologies.orient.core.sql.executor.OResult;
import com.orientechnologies.orient.core.sql.executor.OResultSet;
import java.io.File;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/**
 * Embedded OrientDB driver. Nodes, edges and log entries are plain document classes; structured
 * values (provenance, tags, embeddings, snapshots) are stored as JSON strings. Writes go through a
 * single lock and one OrientDB transaction per unit of work.
 */
public class OrientGraphStore implements GraphStore {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(OrientGraphStore.class);

  static final String NODE_CLASS = "MemoNode";
  static final String EDGE_CLASS = "MemoEdge";
  static final String LOG_CLASS = "MemoLog";

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private final Configuration configuration;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final ReentrantLock writeLock = new ReentrantLock();
  private final AtomicLong logSequence = new AtomicLong();

  private OrientDB orient;
  private ODatabasePool pool;
  private String database;

  public OrientGraphStore(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  @Override
  public void initialize() {
    if (initialized.get()) return;

    try {
      String mode = configuration.getString("memo.store.orientdb.mode", "memory").trim();
      this.database = configuration.getString("memo.store.orientdb.database", "memo");
      String user = configuration.getString("memo.store.orientdb.user", "admin");
      String password = configuration.getString("memo.store.orientdb.password", "admin");

      OrientDBConfig config =
          OrientDBConfig.builder()
              .addConfig(OGlobalConfiguration.CREATE_DEFAULT_USERS, true)
              .build();

      ODatabaseType type;
      if ("plocal".equalsIgnoreCase(mode)) {
        String root = configuration.getString("memo.store.orientdb.rootDir", "data/orient");
        File storageRoot = Path.of(root).toFile();
        if (!storageRoot.exists() && !storageRoot.mkdirs()) {
          throw new StoreException("Unable to create OrientDB storage root: " + storageRoot);
        }
        orient = new OrientDB("embedded:" + storageRoot.getAbsolutePath(), config);
        type = ODatabaseType.PLOCAL;
      } else {
        orient = new OrientDB("embedded:", config);
        type = ODatabaseType.MEMORY;
      }

      orient.createIfNotExists(database, type);
      pool = new ODatabasePool(orient, database, user, password);

      try (ODatabaseSession db = pool.acquire()) {
        setupSchema(db);
        try (OResultSet rs = db.query("SELECT max(seq) AS maxSeq FROM " + LOG_CLASS)) {
          Number max = rs.hasNext() ? rs.next().getProperty("maxSeq") : null;
          logSequence.set(max == null ? 0L : max.longValue());
        }
      }
      initialized.set(true);
      log.info("OrientDB store '{}' ready ({} mode)", database, type);
    } catch (StoreException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreException("Failed to initialize OrientGraphStore", e);
    }
  }

  private OClass ensureClass(OSchema schema, String name) {
    OClass cls = schema.getClass(name);
    if (cls == null) {
      cls = schema.createClass(name);
    }
    return cls;
  }

  private void ensureProperty(OClass cls, String prop, OType type) {
    if (cls.getProperty(prop) == null) {
      cls.createProperty(prop, type);
    }
  }

  private void ensureIndex(OClass cls, String indexName, OClass.INDEX_TYPE kind, String... props) {
    if (cls.getClassIndex(indexName) == null) {
      cls.createIndex(indexName, kind, props);
    }
  }

  private void setupSchema(ODatabaseSession db) {
    OSchema schema = db.getMetadata().getSchema();

    OClass node = ensureClass(schema, NODE_CLASS);
    ensureProperty(node, "nodeId", OType.STRING);
    ensureProperty(node, "ownerId", OType.STRING);
    ensureIndex(node, NODE_CLASS + ".nodeId.unique", OClass.INDEX_TYPE.UNIQUE, "nodeId");
    ensureIndex(node, NODE_CLASS + ".ownerId", OClass.INDEX_TYPE.NOTUNIQUE, "ownerId");

    OClass edge = ensureClass(schema, EDGE_CLASS);
    ensureProperty(edge, "edgeId", OType.STRING);
    ensureProperty(edge, "ownerId", OType.STRING);
    ensureProperty(edge, "sourceId", OType.STRING);
    ensureProperty(edge, "targetId", OType.STRING);
    ensureProperty(edge, "type", OType.STRING);
    ensureIndex(edge, EDGE_CLASS + ".edgeId.unique", OClass.INDEX_TYPE.UNIQUE, "edgeId");
    ensureIndex(
        edge,
        EDGE_CLASS + ".triple.unique",
        OClass.INDEX_TYPE.UNIQUE,
        "ownerId",
        "sourceId",
        "targetId",
        "type");

    OClass entry = ensureClass(schema, LOG_CLASS);
    ensureProperty(entry, "logId", OType.STRING);
    ensureProperty(entry, "ownerId", OType.STRING);
    ensureProperty(entry, "seq", OType.LONG);
    ensureIndex(entry, LOG_CLASS + ".ownerId", OClass.INDEX_TYPE.NOTUNIQUE, "ownerId");
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public <T> T read(Function<GraphTransaction, T> work) {
    checkInitialized();
    try (ODatabaseSession db = pool.acquire()) {
      return work.apply(new OrientTransaction(db, false));
    }
  }

  @Override
  public <T> T inTransaction(Function<GraphTransaction, T> work) {
    checkInitialized();
    writeLock.lock();
    long sequenceBefore = logSequence.get();
    try (ODatabaseSession db = pool.acquire()) {
      db.begin();
      try {
        T result = work.apply(new OrientTransaction(db, true));
        db.commit();
        return result;
      } catch (RuntimeException e) {
        db.rollback();
        logSequence.set(sequenceBefore);
        throw e;
      }
    } finally {
      writeLock.unlock();
    }
  }

  private void checkInitialized() {
    if (!initialized.get()) {
      throw new StoreException("OrientGraphStore used before initialize()");
    }
  }

  @Override
  public String driverId() {
    return OrientGraphStoreProvider.ID;
  }

  @Override
  public void shutdown() {
    if (!initialized.getAndSet(false)) return;
    try {
      if (pool != null) pool.close();
    } finally {
      if (orient != null) orient.close();
    }
  }

  private final class OrientTransaction implements GraphTransaction {
    private final ODatabaseSession db;
    private final boolean writable;

    private OrientTransaction(ODatabaseSession db, boolean writable) {
      this.db = db;
      this.writable = writable;
    }

    private void checkWritable() {
      if (!writable) {
        throw new IllegalStateException("Write attempted inside a read-only unit of work");
      }
    }

    private <R> List<R> select(Function<OResult, R> mapper, String sql, Object... args) {
      try (OResultSet rs = db.query(sql, args)) {
        return rs.stream().map(mapper).toList();
      }
    }

    private void command(String sql, Object... args) {
      try (OResultSet ignored = db.command(sql, args)) {
        log.trace("Executed: {}", sql);
      }
    }

    @Override
    public Optional<Node> findNode(String ownerId, String nodeId) {
      return select(
              OrientGraphStore.this::toNode,
              "SELECT FROM " + NODE_CLASS + " WHERE ownerId = ? AND nodeId = ?",
              ownerId,
              nodeId)
          .stream()
          .findFirst();
    }

    @Override
    public List<Node> nodes(String ownerId) {
      return select(
          OrientGraphStore.this::toNode,
          "SELECT FROM " + NODE_CLASS + " WHERE ownerId = ?",
          ownerId);
    }

    @Override
    public void putNode(Node node) {
      checkWritable();
      command("DELETE FROM " + NODE_CLASS + " WHERE nodeId = ?", node.id());
      OElement el = db.newElement(NODE_CLASS);
      el.setProperty("nodeId", node.id());
      el.setProperty("ownerId", node.ownerId());
      el.setProperty("folderId", node.folderId());
      el.setProperty("title", node.title());
      el.setProperty("content", node.content());
      el.setProperty("type", node.type().wireName());
      el.setProperty("status", node.status().wireName());
      el.setProperty("provenance", JacksonUtility.toJson(node.provenance()));
      el.setProperty(
          "embedding", node.embedding() == null ? null : JacksonUtility.toJson(node.embedding()));
      el.setProperty("tags", JacksonUtility.toJson(node.tags()));
      el.setProperty("wordCount", node.wordCount());
      el.setProperty("createdAt", node.createdAt().toString());
      el.setProperty("updatedAt", node.updatedAt().toString());
      el.save();
    }

    @Override
    public void removeNode(String ownerId, String nodeId) {
      checkWritable();
      command("DELETE FROM " + NODE_CLASS + " WHERE ownerId = ? AND nodeId = ?", ownerId, nodeId);
    }

    @Override
    public Optional<Edge> findEdge(String ownerId, String edgeId) {
      return select(
              OrientGraphStore.this::toEdge,
              "SELECT FROM " + EDGE_CLASS + " WHERE ownerId = ? AND edgeId = ?",
              ownerId,
              edgeId)
          .stream()
          .findFirst();
    }

    @Override
    public Optional<Edge> findEdge(
        String ownerId, String sourceId, String targetId, EdgeType type) {
      return select(
              OrientGraphStore.this::toEdge,
              "SELECT FROM "
                  + EDGE_CLASS
                  + " WHERE ownerId = ? AND sourceId = ? AND targetId = ? AND type = ?",
              ownerId,
              sourceId,
              targetId,
              type.wireName())
          .stream()
          .findFirst();
    }

    @Override
    public List<Edge> edgesTouching(String ownerId, String nodeId) {
      return select(
          OrientGraphStore.this::toEdge,
          "SELECT FROM " + EDGE_CLASS + " WHERE ownerId = ? AND (sourceId = ? OR targetId = ?)",
          ownerId,
          nodeId,
          nodeId);
    }

    @Override
    public void putEdge(Edge edge) {
      checkWritable();
      command("DELETE FROM " + EDGE_CLASS + " WHERE edgeId = ?", edge.id());
      OElement el = db.newElement(EDGE_CLASS);
      el.setProperty("edgeId", edge.id());
      el.setProperty("ownerId", edge.ownerId());
      el.setProperty("sourceId", edge.sourceId());
      el.setProperty("targetId", edge.targetId());
      el.setProperty("type", edge.type().wireName());
      el.setProperty("status", edge.status().wireName());
      el.setProperty("weight", edge.weight());
      el.setProperty("label", edge.label());
      el.setProperty("provenance", JacksonUtility.toJson(edge.provenance()));
      el.setProperty("createdAt", edge.createdAt().toString());
      el.setProperty("updatedAt", edge.updatedAt().toString());
      el.save();
    }

    @Override
    public void removeEdge(String ownerId, String edgeId) {
      checkWritable();
      command("DELETE FROM " + EDGE_CLASS + " WHERE ownerId = ? AND edgeId = ?", ownerId, edgeId);
    }

    @Override
    public void appendLog(ProvenanceLogEntry entry) {
      checkWritable();
      OElement el = db.newElement(LOG_CLASS);
      el.setProperty("logId", entry.id());
      el.setProperty("seq", logSequence.incrementAndGet());
      el.setProperty("ownerId", entry.ownerId());
      el.setProperty("action", entry.action().wireName());
      el.setProperty("description", entry.description());
      el.setProperty("actor", entry.actor().wireName());
      el.setProperty("modelId", entry.modelId());
      el.setProperty("modelVersion", entry.modelVersion());
      el.setProperty("targetNodeId", entry.targetNodeId());
      el.setProperty("targetEdgeId", entry.targetEdgeId());
      el.setProperty("beforeState", jsonOrNull(entry.beforeState()));
      el.setProperty("afterState", jsonOrNull(entry.afterState()));
      el.setProperty("metadata", JacksonUtility.toJson(entry.metadata()));
      el.setProperty("createdAt", entry.createdAt().toString());
      el.save();
    }

    @Override
    public List<ProvenanceLogEntry> logEntries(String ownerId) {
      return select(
          OrientGraphStore.this::toLogEntry,
          "SELECT FROM " + LOG_CLASS + " WHERE ownerId = ? ORDER BY seq ASC",
          ownerId);
    }

    @Override
    public void clearNodeReferences(String ownerId, String nodeId) {
      checkWritable();
      command(
          "UPDATE " + LOG_CLASS + " SET targetNodeId = null WHERE ownerId = ? AND targetNodeId = ?",
          ownerId,
          nodeId);
    }

    @Override
    public void clearEdgeReferences(String ownerId, String edgeId) {
      checkWritable();
      command(
          "UPDATE " + LOG_CLASS + " SET targetEdgeId = null WHERE ownerId = ? AND targetEdgeId = ?",
          ownerId,
          edgeId);
    }
  }

  private static String jsonOrNull(Map<String, Object> value) {
    return value == null ? null : JacksonUtility.toJson(value);
  }

  Node toNode(OResult r) {
    String embedding = r.getProperty("embedding");
    String tags = r.getProperty("tags");
    Number wordCount = r.getProperty("wordCount");
    return new Node(
        r.getProperty("nodeId"),
        r.getProperty("ownerId"),
        r.getProperty("folderId"),
        r.getProperty("title"),
        r.getProperty("content"),
        NodeType.fromWire(r.getProperty("type")),
        GovernanceStatus.fromWire(r.getProperty("status")),
        readJson(r.getProperty("provenance"), Provenance.class),
        embedding == null ? null : readJson(embedding, float[].class),
        tags == null ? List.of() : readJson(tags, STRING_LIST),
        wordCount == null ? 0 : wordCount.intValue(),
        Instant.parse(r.getProperty("createdAt")),
        Instant.parse(r.getProperty("updatedAt")));
  }

  Edge toEdge(OResult r) {
    Number weight = r.getProperty("weight");
    return new Edge(
        r.getProperty("edgeId"),
        r.getProperty("ownerId"),
        r.getProperty("sourceId"),
        r.getProperty("targetId"),
        EdgeType.fromWire(r.getProperty("type")),
        GovernanceStatus.fromWire(r.getProperty("status")),
        weight == null ? 1.0 : weight.doubleValue(),
        r.getProperty("label"),
        readJson(r.getProperty("provenance"), Provenance.class),
        Instant.parse(r.getProperty("createdAt")),
        Instant.parse(r.getProperty("updatedAt")));
  }

  ProvenanceLogEntry toLogEntry(OResult r) {
    return new ProvenanceLogEntry(
        r.getProperty("logId"),
        r.getProperty("ownerId"),
        ProvenanceAction.fromWire(r.getProperty("action")),
        r.getProperty("description"),
        CreatorType.fromWire(r.getProperty("actor")),
        r.getProperty("modelId"),
        r.getProperty("modelVersion"),
        r.getProperty("targetNodeId"),
        r.getProperty("targetEdgeId"),
        JacksonUtility.fromJsonToMap(r.getProperty("beforeState")),
        JacksonUtility.fromJsonToMap(r.getProperty("afterState")),
        JacksonUtility.fromJsonToMap(r.getProperty("metadata")),
        Instant.parse(r.getProperty("createdAt")));
  }

  private static <T> T readJson(String json, Class<T> type) {
    try {
      return JacksonUtility.getJsonMapper().readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException("Failed to read stored " + type.getSimpleName(), e);
    }
  }

  private static <T> T readJson(String json, TypeReference<T> type) {
    try {
      return JacksonUtility.getJsonMapper().readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException("Failed to read stored value", e);
    }
  }
}
