package ca.gc.cra.leap.config;

import ca.gc.cra.leap.application.Controller;
import ca.gc.cra.leap.application.DispatchSettings;
import ca.gc.cra.leap.application.managed.ManagedController;
import ca.gc.cra.leap.application.port.LeapException;
import ca.gc.cra.leap.application.port.LeapService;
import ca.gc.cra.leap.application.port.MetricsPort;
import ca.gc.cra.leap.application.port.ProcessTerminator;
import ca.gc.cra.leap.infrastructure.leap.libleap.JnrLeapService;
import ca.gc.cra.leap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.leap.logging.LoggingConfigurator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link LeapConfig} into controllers.
 * <p><strong>Why:</strong> Keeps adapter selection (native library, metrics backend, failure policy) in one place so
 * applications only pick a config.</p>
 * <p><strong>Role:</strong> Composition root for host applications.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; factory methods may be called from any
 * thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final LeapConfig config;
  private final LeapService service;
  private final DispatchSettings settings;

  /**
   * Builds the native wiring for {@code config} and applies its logging setting.
   *
   * @param config effective configuration
   */
  public CompositionRoot(LeapConfig config) {
    this(config, new JnrLeapService(config.nativeLibrary()), DispatchSettings.HALT);
  }

  /**
   * Builds wiring around an explicit service and terminator, for simulations and tests.
   *
   * @param config effective configuration
   * @param service event-source factory
   * @param terminator failure policy
   */
  public CompositionRoot(LeapConfig config, LeapService service, ProcessTerminator terminator) {
    this.config = Objects.requireNonNull(config, "config");
    this.service = Objects.requireNonNull(service, "service");
    if (config.verboseLogging()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    MetricsPort metrics = config.metricsEnabled() ? new OpenTelemetryMetricsAdapter() : MetricsPort.NO_OP;
    this.settings = new DispatchSettings(
        metrics, Objects.requireNonNull(terminator, "terminator"), config.failureExitCode(), config.metricPrefix());
    log.info(
        "Leap bridge wired (library={}, metrics={}, failureExitCode={})",
        config.nativeLibrary(),
        config.metricsEnabled(),
        config.failureExitCode());
  }

  public LeapConfig config() {
    return config;
  }

  public LeapService service() {
    return service;
  }

  public DispatchSettings dispatchSettings() {
    return settings;
  }

  /**
   * Opens a controller against the configured service.
   *
   * @return unconnected controller
   * @throws LeapException if the session cannot be opened
   */
  public Controller controller() throws LeapException {
    return Controller.create(service, settings);
  }

  /**
   * Opens a managed controller against the configured service.
   *
   * @return unconnected managed controller
   * @throws LeapException if the session cannot be opened
   */
  public ManagedController managedController() throws LeapException {
    return ManagedController.create(service, settings);
  }
}
