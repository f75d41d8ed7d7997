package com.memo.ontology.store.memory;

import com.memo.ontology.store.GraphStore;
import com.memo.ontology.store.GraphStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the heap-backed driver; the default and the one tests run against. */
public class InMemoryGraphStoreProvider implements GraphStoreProvider {
  static final String ID = "in-memory";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public GraphStore create(Configuration configuration) {
    return new InMemoryGraphStore();
  }
}
