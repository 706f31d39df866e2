package ca.gc.cra.leap.domain;

/**
 * <strong>What:</strong> Snapshot of one frame of tracking data.
 * <p><strong>Why:</strong> Native frames live in service-owned memory; copying the summary out lets callers keep
 * the value after the query returns.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Callers must check {@link #valid()} before using the other fields. An invalid frame is returned when the
 * requested history is out of range or the service has not produced that much history yet.</p>
 *
 * @param id frame identifier, incremented by the service for every reported frame
 * @param timestamp capture time
 * @param framesPerSecond instantaneous frame rate at capture
 * @param valid whether this frame contains real data
 * @since 0.1.0
 */
public record Frame(long id, Timestamp timestamp, float framesPerSecond, boolean valid) {
  private static final Frame INVALID = new Frame(-1L, new Timestamp(0L), 0f, false);

  /**
   * Returns the shared invalid frame.
   *
   * @return frame whose {@link #valid()} is {@code false}
   */
  public static Frame invalid() {
    return INVALID;
  }
}
