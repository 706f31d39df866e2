package ca.gc.cra.leap.domain.image;

/**
 * Identifies one of the two cameras on the device.
 *
 * @since 0.1.0
 */
public enum Camera {
  LEFT,
  RIGHT;

  /**
   * Maps the native image id to a camera.
   *
   * @param id image id reported by the service ({@code 0} left, {@code 1} right)
   * @return matching camera
   * @throws IllegalStateException if the service reports any other id
   */
  public static Camera fromImageId(int id) {
    return switch (id) {
      case 0 -> LEFT;
      case 1 -> RIGHT;
      default -> throw new IllegalStateException("encountered invalid image id " + id);
    };
  }
}
