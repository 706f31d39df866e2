package ca.gc.cra.leap.application.port;

import ca.gc.cra.leap.domain.LeapEvent;

/**
 * Inbound port the event source calls once per event occurrence.
 *
 * <p>Implementations run on the event-source thread. They must not block, and must not let a failure propagate
 * back into the caller.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventDispatcher {
  /**
   * Delivers one event to the listener identified by {@code token}.
   *
   * @param token correlation token handed to the session in {@link LeapSession#attach(long)}
   * @param event occurred event
   */
  void dispatch(long token, LeapEvent event);
}
