package ca.gc.cra.leap.application.managed;

import java.time.Duration;

/** Timeout arithmetic shared by the wait primitives. */
final class WaitTimeouts {
  private WaitTimeouts() {}

  /**
   * Converts a timeout to nanoseconds, saturating at {@link Long#MAX_VALUE} for durations too large to represent.
   *
   * @param timeout timeout to convert
   * @return nanoseconds; negative timeouts stay negative
   */
  static long toNanos(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException overflow) {
      return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }
}
