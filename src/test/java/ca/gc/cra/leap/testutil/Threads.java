package ca.gc.cra.leap.testutil;

import java.util.Queue;
import java.util.concurrent.TimeUnit;

/**
 * Helpers for tests that coordinate with blocked threads.
 */
public final class Threads {
  private Threads() {}

  /**
   * Waits until {@code thread} is parked, so a signal sent afterwards is one it must observe.
   */
  public static void awaitParked(Thread thread) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      Thread.State state = thread.getState();
      if (state == Thread.State.WAITING || state == Thread.State.TIMED_WAITING) {
        return;
      }
      if (state == Thread.State.TERMINATED) {
        throw new AssertionError(thread.getName() + " finished before parking");
      }
      Thread.sleep(1L);
    }
    throw new AssertionError(thread.getName() + " never parked");
  }

  /**
   * Starts a daemon thread running {@code body}, recording any failure into {@code failures}.
   */
  public static Thread start(String name, ThrowingRunnable body, Queue<Throwable> failures) {
    Thread thread = new Thread(() -> {
      try {
        body.run();
      } catch (Throwable ex) {
        failures.add(ex);
      }
    }, name);
    thread.setDaemon(true);
    thread.start();
    return thread;
  }

  @FunctionalInterface
  public interface ThrowingRunnable {
    void run() throws Exception;
  }
}
