package ca.gc.cra.leap.application.managed;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Occurrence counter for an edge-triggered event class (frames, image sets, device changes).
 *
 * <p>Waiters capture the count and block until it differs. Increments and checks share one lock, so an increment
 * that happens after a waiter captured its baseline always releases it. Several increments before the waiter is
 * scheduled release it once; this is an "at least one occurred" signal, not a queue.</p>
 *
 * <p>The count is monotonic and never reset.</p>
 */
final class EdgeCounter {
  private final String name;
  private final Lock lock = new ReentrantLock();
  private final Condition advanced = lock.newCondition();
  private long count;

  EdgeCounter(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  String name() {
    return name;
  }

  /** Records one occurrence and wakes every waiter. */
  void increment() {
    lock.lock();
    try {
      count++;
      advanced.signalAll();
    } finally {
      lock.unlock();
    }
  }

  long count() {
    lock.lock();
    try {
      return count;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until at least one increment happens after this call starts.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  void awaitNext() throws InterruptedException {
    lock.lock();
    try {
      long baseline = count;
      while (count == baseline) {
        advanced.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Timed variant of {@link #awaitNext()}.
   *
   * @param timeout maximum time to wait; zero or negative checks once without blocking
   * @return {@code true} if an increment was observed before the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  boolean awaitNext(Duration timeout) throws InterruptedException {
    long remaining = WaitTimeouts.toNanos(timeout);
    lock.lock();
    try {
      long baseline = count;
      while (count == baseline) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = advanced.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }
}
