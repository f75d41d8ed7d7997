package com.memo.ontology.store;

import com.memo.ontology.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Resolves the {@link GraphStore} named by {@code memo.store.driver} through the SPI. */
public final class GraphStoreFactory {
  private static final org.slf4j.Logger log =
      com.memo.ontology.logging.LoggingService.getLogger(GraphStoreFactory.class);

  public static final String DEFAULT_DRIVER = "in-memory";

  private GraphStoreFactory() {}

  /** Creates and initializes the configured driver. */
  public static GraphStore create(Configuration configuration) {
    String desired =
        configuration.getString("memo.store.driver", DEFAULT_DRIVER).trim().toLowerCase();
    List<String> known = new ArrayList<>();
    for (GraphStoreProvider p : ServiceLoader.load(GraphStoreProvider.class)) {
      known.add(p.id());
      if (desired.equals(p.id())) {
        GraphStore store = p.create(configuration);
        store.initialize();
        log.info("Graph store driver '{}' initialized", desired);
        return store;
      }
    }
    throw new ConfigException(
        "Unknown memo.store.driver '%s', available drivers: %s".formatted(desired, known));
  }
}
