package com.memo.ontology.graph;

import java.util.Objects;

/**
 * The party performing an operation. AI actors carry the model that produced the change; the
 * store uses the creator kind to decide the initial governance status.
 */
public record Actor(CreatorType creator, String modelId, String modelVersion) {

  private static final Actor USER = new Actor(CreatorType.USER, null, null);

  public Actor {
    Objects.requireNonNull(creator, "creator");
  }

  public static Actor user() {
    return USER;
  }

  public static Actor ai(String modelId) {
    return new Actor(CreatorType.AI, modelId, null);
  }

  public boolean isAi() {
    return creator == CreatorType.AI;
  }
}
