package com.memo.ontology.store.orient;

import com.memo.ontology.store.GraphStore;
import com.memo.ontology.store.GraphStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the embedded OrientDB driver. */
public class OrientGraphStoreProvider implements GraphStoreProvider {
  static final String ID = "orientdb";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public GraphStore create(Configuration configuration) {
    return new OrientGraphStore(configuration);
  }
}
