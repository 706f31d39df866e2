package ca.gc.cra.leap.domain;

/**
 * Service or device policy flags.
 *
 * <p>Set policies only after a device is connected; the service may otherwise ignore them. Policies take effect
 * asynchronously, so {@code isPolicySet} can report {@code false} for a while after a set call.</p>
 *
 * @since 0.1.0
 */
public enum Policy {
  /** Deliver frames even when the application does not have focus. */
  BACKGROUND_FRAMES(1),
  /** Deliver raw camera images. */
  IMAGES(1 << 1),
  /** Optimize tracking for a head-mounted device instead of a desk-mounted one. */
  OPTIMIZE_HMD(1 << 2);

  private final int flag;

  Policy(int flag) {
    this.flag = flag;
  }

  /**
   * Returns the native bit flag for this policy.
   *
   * @return policy bit
   */
  public int flag() {
    return flag;
  }
}
