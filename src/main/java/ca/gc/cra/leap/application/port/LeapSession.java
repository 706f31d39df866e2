package ca.gc.cra.leap.application.port;

/**
 * <strong>What:</strong> Port to one open connection with the tracking service (the event source).
 * <p><strong>Why:</strong> Keeps the controller and dispatch bridge independent of the native binding, so they run
 * unchanged against the JNR adapter or an in-memory simulation.</p>
 * <p><strong>Role:</strong> Outbound port implemented by {@code JnrLeapService} and {@code InMemoryLeapService}
 * sessions.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer {@link ControllerView} queries against the live session.</li>
 *   <li>Deliver events for every attached token to the {@link EventDispatcher} supplied at open time.</li>
 *   <li>Serialize deliveries per token, delivering {@code INIT} first and {@code EXIT} last.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Queries and attach/detach may be called from any thread; the session is
 * responsible for its own internal synchronization.</p>
 *
 * @since 0.1.0
 */
public interface LeapSession extends ControllerView, AutoCloseable {
  /**
   * Starts delivering events for {@code token}. The session delivers {@code INIT} for the token before any other
   * event.
   *
   * @param token correlation token, unique for the lifetime of the dispatcher
   * @return {@code true} when the service accepted the registration; {@code false} leaves no trace of the token
   */
  boolean attach(long token);

  /**
   * Stops delivering events for {@code token}. The session delivers {@code EXIT} for the token and does not return
   * while a delivery for that token is in flight.
   *
   * @param token previously attached token
   * @return {@code true} when the token was attached and has now been removed
   */
  boolean detach(long token);

  /**
   * Releases the session. Callers detach every token first.
   */
  @Override
  void close();
}
