package com.codeheadsystems.gatekeeper.server.store;

import java.util.function.Supplier;

/**
 * Groups store writes that must be all-or-nothing, such as consuming a reset token together with
 * the credential deletion and session revocation it triggers.
 * <p>
 * An exception thrown by {@code work} must roll back every write made inside it and propagate
 * unchanged.
 */
public interface TransactionManager {

  /**
   * Runs the work in a single transaction.
   *
   * @param work the work
   * @param <T>  the result type
   * @return the result of the work
   */
  <T> T inTransaction(Supplier<T> work);

  /**
   * Runs the work in a single transaction.
   *
   * @param work the work
   */
  default void inTransaction(Runnable work) {
    inTransaction(() -> {
      work.run();
      return null;
    });
  }
}
