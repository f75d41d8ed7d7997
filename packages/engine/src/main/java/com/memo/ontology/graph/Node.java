package com.memo.ontology.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A typed knowledge unit owned by one tenant.
 *
 * <p>Instances are immutable; the store produces updated copies through the {@code with*}
 * methods. The embedding is copied on the way in and out, and excluded from JSON snapshots.
 */
public record Node(
    String id,
    @JsonProperty("owner_id") String ownerId,
    @JsonProperty("folder_id") String folderId,
    String title,
    String content,
    NodeType type,
    GovernanceStatus status,
    Provenance provenance,
    @JsonIgnore float[] embedding,
    List<String> tags,
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  public Node {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(provenance, "provenance");
    title = title == null ? "" : title;
    content = content == null ? "" : content;
    tags = tags == null ? List.of() : List.copyOf(tags);
    embedding = embedding == null ? null : embedding.clone();
  }

  @JsonIgnore
  @Override
  public float[] embedding() {
    return embedding == null ? null : embedding.clone();
  }

  @JsonIgnore
  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  public Node withStatus(GovernanceStatus newStatus, Instant now) {
    return new Node(
        id, ownerId, folderId, title, content, type, newStatus, provenance, embedding, tags,
        wordCount, createdAt, now);
  }

  public Node withEmbedding(float[] vector, Instant now) {
    return new Node(
        id, ownerId, folderId, title, content, type, status, provenance, vector, tags, wordCount,
        createdAt, now);
  }

  /** Copy with edited fields; word count is supplied by the caller. */
  public Node withFields(
      String newTitle,
      String newContent,
      NodeType newType,
      String newFolderId,
      List<String> newTags,
      int newWordCount,
      Instant now) {
    return new Node(
        id, ownerId, newFolderId, newTitle, newContent, newType, status, provenance, embedding,
        newTags, newWordCount, createdAt, now);
  }

  @Override
  public String toString() {
    return "Node{id=" + id + ", type=" + type + ", status=" + status + ", title=" + title + '}';
  }
}
