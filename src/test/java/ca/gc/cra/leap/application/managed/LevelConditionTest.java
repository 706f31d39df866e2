package ca.gc.cra.leap.application.managed;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.leap.testutil.Threads;
import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class LevelConditionTest {
  private static final Duration TEST_TIMEOUT = Duration.ofSeconds(10);

  @Test
  void returnsImmediatelyWhenValueAlreadyMatches() {
    assertTimeoutPreemptively(TEST_TIMEOUT, () -> {
      AtomicBoolean value = new AtomicBoolean(true);
      LevelCondition condition = new LevelCondition("focus", value::get);

      condition.await(true);
      assertTrue(condition.await(true, Duration.ZERO));
      assertFalse(condition.await(false, Duration.ofMillis(20)));
    });
  }

  @Test
  void hugeTimeoutDoesNotOverflow() {
    assertTimeoutPreemptively(TEST_TIMEOUT, () -> {
      LevelCondition condition = new LevelCondition("deviceConnected", () -> true);

      assertTrue(condition.await(true, Duration.ofSeconds(Long.MAX_VALUE)));
      assertFalse(condition.await(false, Duration.ofSeconds(Long.MIN_VALUE)));
    });
  }

  @Test
  void waiterWakesWhenValueFlipsAndIsSignalled() {
    assertTimeoutPreemptively(TEST_TIMEOUT, () -> {
      AtomicBoolean value = new AtomicBoolean(false);
      LevelCondition condition = new LevelCondition("deviceConnected", value::get);
      Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
      Thread waiter = Threads.start("waiter", () -> condition.await(true), failures);
      Threads.awaitParked(waiter);

      value.set(true);
      condition.signal(true);
      waiter.join();

      assertTrue(failures.isEmpty(), failures.toString());
    });
  }

  @Test
  void signalForTheOtherValueDoesNotReleaseWaiter() {
    assertTimeoutPreemptively(TEST_TIMEOUT, () -> {
      AtomicBoolean value = new AtomicBoolean(true);
      LevelCondition condition = new LevelCondition("serviceConnected", value::get);
      Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
      Thread waiter = Threads.start("waiter", () -> condition.await(false), failures);
      Threads.awaitParked(waiter);

      condition.signal(true);
      waiter.join(50L);
      assertTrue(waiter.isAlive());

      value.set(false);
      condition.signal(false);
      waiter.join();
      assertTrue(failures.isEmpty(), failures.toString());
    });
  }
}
