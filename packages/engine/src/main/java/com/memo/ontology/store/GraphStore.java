package com.memo.ontology.store;

import java.util.function.Function;

/**
 * Persistence driver behind the {@link OntologyStore}.
 *
 * <p>Drivers own storage, transactions and owner scoping; the ontology invariants are enforced by
 * the store above them. Writes are serialized, reads may proceed concurrently. A unit of work that
 * throws leaves the underlying data untouched.
 */
public interface GraphStore extends AutoCloseable {

  /** Initialize the driver and any underlying connections/resources. */
  void initialize();

  /** @return true when the driver is ready to accept operations. */
  boolean isInitialized();

  /** Runs read-only work against a consistent view. */
  <T> T read(Function<GraphTransaction, T> work);

  /** Runs work as a single atomic write; any exception rolls back every change it made. */
  <T> T inTransaction(Function<GraphTransaction, T> work);

  /** @return the provider id this driver was created by. */
  String driverId();

  /** Shut down the driver and release resources. */
  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
