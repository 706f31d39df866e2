package ca.gc.cra.leap.application.port;

/**
 * Checked exception thrown when a tracking session cannot be opened.
 *
 * @since 0.1.0
 */
public final class LeapException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public LeapException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause from the native binding
   */
  public LeapException(String msg, Throwable cause) { super(msg, cause); }
}
