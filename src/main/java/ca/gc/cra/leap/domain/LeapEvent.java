package ca.gc.cra.leap.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of occurrences raised by the tracking service.
 * <p><strong>Why:</strong> Gives the native shim and the dispatch bridge a shared, stable vocabulary.</p>
 * <p><strong>Role:</strong> Domain value carried across the event-source port.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * <p>Events carry no payload. Hooks pull the current frame or image set from the session when they run.</p>
 *
 * @since 0.1.0
 */
public enum LeapEvent {
  /** Listener was attached to a controller. */
  INIT(0),
  /** A tracking device was plugged in. */
  CONNECT(1),
  /** The tracking device went away. */
  DISCONNECT(2),
  /** Listener was detached or its controller closed. */
  EXIT(3),
  /** New tracking data is available. */
  FRAME(4),
  /** The application received device focus. */
  FOCUS_GAINED(5),
  /** The application lost device focus. */
  FOCUS_LOST(6),
  /** Connection to the tracking service was established. */
  SERVICE_CONNECT(7),
  /** Connection to the tracking service dropped. */
  SERVICE_DISCONNECT(8),
  /** Device configuration changed (plugged, removed, robust mode, capture rate). */
  DEVICE_CHANGE(9),
  /** A new set of raw camera images is available. */
  IMAGES(10);

  private static final LeapEvent[] BY_CODE = values();

  private final int code;
  private final String metricName;

  LeapEvent(int code) {
    this.code = code;
    this.metricName = name().toLowerCase(Locale.ROOT).replace('_', '.');
  }

  /**
   * Returns the integer code used by the native shim for this event.
   *
   * @return native event code
   */
  public int code() {
    return code;
  }

  /**
   * Returns the dotted lower-case name used when tagging metrics (e.g., {@code focus.gained}).
   *
   * @return metric-friendly event name
   */
  public String metricName() {
    return metricName;
  }

  /**
   * Resolves a native event code.
   *
   * @param code code received from the event source
   * @return matching event, or empty when the code is outside the known range
   */
  public static Optional<LeapEvent> fromCode(int code) {
    if (code < 0 || code >= BY_CODE.length) {
      return Optional.empty();
    }
    return Optional.of(BY_CODE[code]);
  }
}
