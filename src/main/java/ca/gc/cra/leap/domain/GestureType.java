package ca.gc.cra.leap.domain;

/**
 * Gestures the tracking service can detect and report in frames.
 *
 * @since 0.1.0
 */
public enum GestureType {
  /** Horizontal swipe of a hand with fingers extended. */
  SWIPE(1),
  /** A single finger moving in a circle. */
  CIRCLE(4),
  /** Tap parallel to the device, like touching a vertical screen. */
  SCREEN_TAP(5),
  /** Tap towards the device, like pressing a key. */
  KEY_TAP(6);

  private final int code;

  GestureType(int code) {
    this.code = code;
  }

  /**
   * Returns the native gesture type code.
   *
   * @return gesture code
   */
  public int code() {
    return code;
  }
}
