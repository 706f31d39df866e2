package ca.gc.cra.leap.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the dispatch path.
 * <p><strong>Why:</strong> Lets the bridge count deliveries and failures without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from the event-source thread and
 * application threads.</p>
 * <p><strong>Performance:</strong> Calls happen on the event-source thread for every event; they must not block.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code leap.dispatch.frame}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
