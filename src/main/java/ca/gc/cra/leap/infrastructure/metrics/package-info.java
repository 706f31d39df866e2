/**
 * Metrics adapters that bridge the dispatch {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the configured dispatch prefix, {@code leap.dispatch.*} by default:
 * one counter per event kind, {@code failure}, and the {@code latencyNanos} histogram.</p>
 * <p><strong>Concurrency:</strong> Thread-safe; instruments are cached per key.</p>
 */
package ca.gc.cra.leap.infrastructure.metrics;
