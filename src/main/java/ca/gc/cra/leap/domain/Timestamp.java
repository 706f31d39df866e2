package ca.gc.cra.leap.domain;

import java.time.Duration;

/**
 * Timestamp reported by the tracking service, in microseconds on the service clock.
 *
 * <p>Values are only comparable with other timestamps from the same service instance.</p>
 *
 * @param micros raw microsecond value
 * @since 0.1.0
 */
public record Timestamp(long micros) implements Comparable<Timestamp> {

  /**
   * Returns the elapsed time between {@code earlier} and this timestamp.
   *
   * @param earlier timestamp that must not be later than this one
   * @return non-negative duration
   * @throws IllegalArgumentException if {@code earlier} is later than this timestamp
   */
  public Duration durationSince(Timestamp earlier) {
    if (earlier.micros > micros) {
      throw new IllegalArgumentException(
          "timestamp " + earlier + " is later than " + this);
    }
    return Duration.ofNanos(Math.multiplyExact(micros - earlier.micros, 1_000L));
  }

  @Override
  public int compareTo(Timestamp other) {
    return Long.compare(micros, other.micros);
  }

  @Override
  public String toString() {
    return micros + "us";
  }
}
