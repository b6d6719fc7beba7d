package com.codeheadsystems.gatekeeper.server.store;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes transactional work behind one lock. The in-memory stores cannot roll back, so callers
 * order their work to perform every check that may fail before the first write.
 * Suitable for development and testing only.
 */
public class InMemoryTransactionManager implements TransactionManager {

  private final ReentrantLock lock = new ReentrantLock();

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
