package com.memo.ontology.store;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable persistence drivers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in {@code
 * META-INF/services/com.memo.ontology.store.GraphStoreProvider}.
 */
public interface GraphStoreProvider {

  /** A stable, lowercase identifier matched against {@code memo.store.driver}. */
  String id();

  /**
   * Creates an uninitialized driver.
   *
   * @param configuration full application configuration
   */
  GraphStore create(Configuration configuration);
}
