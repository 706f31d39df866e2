package ca.gc.cra.leap.application;

import ca.gc.cra.leap.application.port.ControllerView;
import ca.gc.cra.leap.application.port.EventDispatcher;
import ca.gc.cra.leap.application.port.Listener;
import ca.gc.cra.leap.application.port.MetricsPort;
import ca.gc.cra.leap.domain.LeapEvent;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Routes event-source callbacks to the listener they were raised for.
 * <p><strong>Why:</strong> The service calls in on a thread it owns. User code running there must never unwind back
 * into the caller or leave it resuming above a half-finished handler.</p>
 * <p><strong>Role:</strong> Application-side implementation of {@link EventDispatcher}; one bridge per controller.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve correlation tokens to registrations; unknown or exited tokens are dropped.</li>
 *   <li>Invoke exactly one listener hook per event, in arrival order, with no batching or coalescing.</li>
 *   <li>Catch every failure raised after a token resolves, in the hook or in the metrics calls, and hand it to the
 *       configured terminator.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent dispatch and registration. Takes no locks and never blocks.</p>
 * <p><strong>Observability:</strong> Emits {@code <prefix>.<event>}, {@code <prefix>.latencyNanos} and
 * {@code <prefix>.failure}; logs failures at ERROR before terminating.</p>
 *
 * @since 0.1.0
 */
public final class DispatchBridge implements EventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(DispatchBridge.class);

  private final ConcurrentMap<Long, ListenerRegistration> registrations = new ConcurrentHashMap<>();
  private final AtomicLong nextToken = new AtomicLong(1L);
  private final DispatchSettings settings;
  private final MetricsPort metrics;
  private final String prefix;

  /**
   * Creates a bridge.
   *
   * @param settings metrics, terminator and exit status to apply
   */
  public DispatchBridge(DispatchSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = settings.metrics();
    this.prefix = settings.metricPrefix();
  }

  @Override
  public void dispatch(long token, LeapEvent event) {
    if (event == null) {
      log.warn("Ignoring null event for token {}", token);
      return;
    }
    ListenerRegistration registration = registrations.get(token);
    if (registration == null) {
      log.debug("Dropping {} for unknown token {}", event, token);
      return;
    }
    if (!registration.begin(event)) {
      log.debug("Dropping {} for token {} in state {}", event, token, registration.state());
      return;
    }

    long start = System.nanoTime();
    try {
      deliver(registration.listener(), event, registration.view());
      metrics.increment(prefix + '.' + event.metricName());
      metrics.observe(prefix + ".latencyNanos", System.nanoTime() - start);
      if (event == LeapEvent.EXIT) {
        registrations.remove(token, registration);
      }
    } catch (Throwable failure) {
      fail(registration, event, failure);
    }
  }

  long nextToken() {
    return nextToken.getAndIncrement();
  }

  void register(ListenerRegistration registration) {
    ListenerRegistration previous = registrations.putIfAbsent(registration.token(), registration);
    if (previous != null) {
      throw new IllegalStateException("token already registered: " + registration.token());
    }
  }

  void unregister(ListenerRegistration registration) {
    registrations.remove(registration.token(), registration);
  }

  int registeredCount() {
    return registrations.size();
  }

  private void fail(ListenerRegistration registration, LeapEvent event, Throwable failure) {
    registration.markFailed();
    registrations.remove(registration.token(), registration);
    try {
      metrics.increment(prefix + ".failure");
    } catch (RuntimeException metricsFailure) {
      if (metricsFailure != failure) {
        failure.addSuppressed(metricsFailure);
      }
    }
    try {
      log.error(
          "Dispatch of {} to listener {} (token {}) failed; terminating process with status {}",
          event,
          registration.listener().getClass().getName(),
          registration.token(),
          settings.failureExitCode(),
          failure);
    } finally {
      settings.terminator().terminate(settings.failureExitCode(), failure);
    }
  }

  private static void deliver(Listener listener, LeapEvent event, ControllerView view) {
    switch (event) {
      case INIT -> listener.onInit(view);
      case CONNECT -> listener.onConnect(view);
      case DISCONNECT -> listener.onDisconnect(view);
      case EXIT -> listener.onExit(view);
      case FRAME -> listener.onFrame(view);
      case FOCUS_GAINED -> listener.onFocusGained(view);
      case FOCUS_LOST -> listener.onFocusLost(view);
      case SERVICE_CONNECT -> listener.onServiceConnect(view);
      case SERVICE_DISCONNECT -> listener.onServiceDisconnect(view);
      case DEVICE_CHANGE -> listener.onDeviceChange(view);
      case IMAGES -> listener.onImages(view);
      default -> throw new IllegalArgumentException("unhandled event " + event);
    }
  }
}
