package ca.gc.cra.leap.application.port;

/**
 * Factory port for sessions with the tracking service.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LeapService {
  /**
   * Opens a session. The connection to the service proceeds in the background; this call does not wait for it.
   *
   * @param dispatcher receiver for every event the session raises
   * @return open, possibly not yet connected, session
   * @throws LeapException if the session cannot be created (e.g., the native library is missing)
   */
  LeapSession open(EventDispatcher dispatcher) throws LeapException;
}
