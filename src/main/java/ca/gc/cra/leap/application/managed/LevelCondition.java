package ca.gc.cra.leap.application.managed;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Waitable view of a level-triggered session property (service connected, device connected, focus).
 *
 * <p>The current value is read from the session under this condition's lock. The session flips the value before it
 * raises the matching event, and the event handler takes the same lock to signal. A flip that lands between a
 * waiter's check and its block therefore cannot be missed: the signal waits until the waiter has released the lock
 * inside {@code await}.</p>
 */
final class LevelCondition {
  private final String name;
  private final BooleanSupplier value;
  private final Lock lock = new ReentrantLock();
  private final Condition becameTrue = lock.newCondition();
  private final Condition becameFalse = lock.newCondition();

  LevelCondition(String name, BooleanSupplier value) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = Objects.requireNonNull(value, "value");
  }

  String name() {
    return name;
  }

  /**
   * Wakes waiters after the property changed.
   *
   * @param now value the property changed to
   */
  void signal(boolean now) {
    lock.lock();
    try {
      (now ? becameTrue : becameFalse).signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until the property equals {@code target}. Returns at once when it already does.
   *
   * @param target awaited value
   * @throws InterruptedException if interrupted while waiting
   */
  void await(boolean target) throws InterruptedException {
    Condition condition = target ? becameTrue : becameFalse;
    lock.lock();
    try {
      while (value.getAsBoolean() != target) {
        condition.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Timed variant of {@link #await(boolean)}.
   *
   * @param target awaited value
   * @param timeout maximum time to wait
   * @return {@code true} if the property reached {@code target} before the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   */
  boolean await(boolean target, Duration timeout) throws InterruptedException {
    Condition condition = target ? becameTrue : becameFalse;
    long remaining = WaitTimeouts.toNanos(timeout);
    lock.lock();
    try {
      while (value.getAsBoolean() != target) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = condition.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }
}
