package com.memo.ontology.graph;

import java.util.List;

/**
 * Partial update of a node's editable fields. Null means "leave unchanged"; the folder can be
 * detached explicitly with {@link Builder#clearFolder()}. Status is not editable here, it only
 * moves through governance transitions.
 */
public final class NodePatch {
  private final String title;
  private final String content;
  private final NodeType type;
  private final String folderId;
  private final boolean clearFolder;
  private final List<String> tags;

  private NodePatch(Builder b) {
    this.title = b.title;
    this.content = b.content;
    this.type = b.type;
    this.folderId = b.folderId;
    this.clearFolder = b.clearFolder;
    this.tags = b.tags == null ? null : List.copyOf(b.tags);
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

  public String folderId() {
    return folderId;
  }

  public boolean clearFolder() {
    return clearFolder;
  }

  public List<String> tags() {
    return tags;
  }

  public boolean isEmpty() {
    return title == null
        && content == null
        && type == null
        && folderId == null
        && !clearFolder
        && tags == null;
  }

  public static final class Builder {
    private String title;
    private String content;
    private NodeType type;
    private String folderId;
    private boolean clearFolder;
    private List<String> tags;

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

    public Builder folderId(String folderId) {
      this.folderId = folderId;
      this.clearFolder = false;
      return this;
    }

    public Builder clearFolder() {
      this.folderId = null;
      this.clearFolder = true;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = tags;
      return this;
    }

    public NodePatch build() {
      return new NodePatch(this);
    }
  }
}
