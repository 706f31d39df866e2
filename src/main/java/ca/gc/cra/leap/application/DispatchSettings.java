package ca.gc.cra.leap.application;

import ca.gc.cra.leap.application.port.MetricsPort;
import ca.gc.cra.leap.application.port.ProcessTerminator;
import java.util.Objects;

/**
 * Collaborators and policy for the {@link DispatchBridge}.
 *
 * @param metrics metrics sink for delivery counters and latency; {@code null} falls back to {@link MetricsPort#NO_OP}
 * @param terminator invoked after a listener failure
 * @param failureExitCode process status passed to {@code terminator}
 * @param metricPrefix prefix for emitted metric keys; blank falls back to {@value #DEFAULT_METRIC_PREFIX}
 * @since 0.1.0
 */
public record DispatchSettings(
    MetricsPort metrics,
    ProcessTerminator terminator,
    int failureExitCode,
    String metricPrefix) {
  /** Status used when a listener fails; matches an abort. */
  public static final int DEFAULT_FAILURE_EXIT_CODE = 134;
  /** Default prefix for dispatch metrics. */
  public static final String DEFAULT_METRIC_PREFIX = "leap.dispatch";

  /** Halts the JVM without running shutdown hooks; the event-source thread never resumes. */
  public static final ProcessTerminator HALT = (status, cause) -> Runtime.getRuntime().halt(status);

  public DispatchSettings {
    metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    Objects.requireNonNull(terminator, "terminator");
    metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? DEFAULT_METRIC_PREFIX : metricPrefix.trim();
  }

  /**
   * Settings without metrics that halt the JVM on listener failure.
   *
   * @return default settings
   */
  public static DispatchSettings defaults() {
    return new DispatchSettings(MetricsPort.NO_OP, HALT, DEFAULT_FAILURE_EXIT_CODE, DEFAULT_METRIC_PREFIX);
  }

  /**
   * Returns a copy using a different terminator.
   *
   * @param replacement terminator to use
   * @return updated settings
   */
  public DispatchSettings withTerminator(ProcessTerminator replacement) {
    return new DispatchSettings(metrics, replacement, failureExitCode, metricPrefix);
  }

  /**
   * Returns a copy using a different metrics sink.
   *
   * @param replacement metrics sink
   * @return updated settings
   */
  public DispatchSettings withMetrics(MetricsPort replacement) {
    return new DispatchSettings(replacement, terminator, failureExitCode, metricPrefix);
  }
}
