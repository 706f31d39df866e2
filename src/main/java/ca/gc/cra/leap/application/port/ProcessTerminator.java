package ca.gc.cra.leap.application.port;

/**
 * Ends the process after an unrecoverable failure on the event-source thread.
 *
 * <p>Production implementations never return. Test doubles may return, in which case the caller stops delivering to
 * the failed listener instead of resuming it.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProcessTerminator {
  /**
   * Terminates the process.
   *
   * @param status process exit status
   * @param cause failure that triggered termination
   */
  void terminate(int status, Throwable cause);
}
