package ca.gc.cra.leap.infrastructure.metrics;

import ca.gc.cra.leap.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that records dispatch counters and latency histograms in OpenTelemetry.
 * <p><strong>Thread-safety:</strong> Instruments are created once per key and cached in concurrent maps; updates
 * arrive on the event-source thread.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("leap.metric.key");
  private static final String FALLBACK_METRIC_NAME = "leap.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Counter instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(sanitize(key))
        .setUnit("1")
        .setDescription("Leap bridge counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitize(key))
        .ofLongs()
        .setDescription("Leap bridge observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  /** Instrument names must start with a letter and use only {@code [a-z0-9._-]}. */
  static String sanitize(String key) {
    String lower = key.trim().toLowerCase(Locale.ROOT);
    if (lower.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    if (!name.toString().equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    }
    return name.toString();
  }

  private record Counter(LongCounter counter, Attributes attributes) {}

  private record Histogram(LongHistogram histogram, Attributes attributes) {}
}
