package com.memo.ontology.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Caller-supplied fields for a new node. The requested status is only a hint: AI-authored drafts
 * always become Experimental.
 */
public final class NodeDraft {
  private final String title;
  private final String content;
  private final NodeType type;
  private final GovernanceStatus requestedStatus;
  private final String folderId;
  private final List<String> tags;
  private final String sourceNodeId;
  private final Double confidence;
  private final ProvenanceMethod method;

  private NodeDraft(Builder b) {
    this.title = b.title;
    this.content = b.content;
    this.type = b.type;
    this.requestedStatus = b.requestedStatus;
    this.folderId = b.folderId;
    this.tags = List.copyOf(b.tags);
    this.sourceNodeId = b.sourceNodeId;
    this.confidence = b.confidence;
    this.method = b.method;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String title() {
    return title;
  }

  public String content() {
    return content;
  }

  public NodeType type() {
    return type;
  }

  public GovernanceStatus requestedStatus() {
    return requestedStatus;
  }

  public String folderId() {
    return folderId;
  }

  public List<String> tags() {
    return tags;
  }

  public String sourceNodeId() {
    return sourceNodeId;
  }

  public Double confidence() {
    return confidence;
  }

  public ProvenanceMethod method() {
    return method;
  }

  public static final class Builder {
    private String title = "";
    private String content = "";
    private NodeType type = NodeType.NOTE;
    private GovernanceStatus requestedStatus;
    private String folderId;
    private final List<String> tags = new ArrayList<>();
    private String sourceNodeId;
    private Double confidence;
    private ProvenanceMethod method;

    private Builder() {}

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder content(String content) {
      this.content = content;
      return this;
    }

    public Builder type(NodeType type) {
      this.type = type;
      return this;
    }

    public Builder status(GovernanceStatus status) {
      this.requestedStatus = status;
      return this;
    }

    public Builder folderId(String folderId) {
      this.folderId = folderId;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags.clear();
      if (tags != null) this.tags.addAll(tags);
      return this;
    }

    public Builder tag(String tag) {
      this.tags.add(tag);
      return this;
    }

    public Builder sourceNodeId(String sourceNodeId) {
      this.sourceNodeId = sourceNodeId;
      return this;
    }

    public Builder confidence(Double confidence) {
      this.confidence = confidence;
      return this;
    }

    public Builder method(ProvenanceMethod method) {
      this.method = method;
      return this;
    }

    public NodeDraft build() {
      return new NodeDraft(this);
    }
  }
}
