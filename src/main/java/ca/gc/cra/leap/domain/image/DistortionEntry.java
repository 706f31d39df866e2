package ca.gc.cra.leap.domain.image;

/**
 * One entry of the distortion map: the U/V texture coordinates to sample in the raw camera image.
 *
 * <p>The map is smaller than the camera image, so neighbouring entries are meant to be linearly interpolated.</p>
 *
 * @param u horizontal texture coordinate
 * @param v vertical texture coordinate
 * @since 0.1.0
 */
public record DistortionEntry(float u, float v) {

  /**
   * Returns whether the entry points at real camera data.
   *
   * @return {@code true} when both coordinates lie within {@code [0, 1]}
   */
  public boolean isValid() {
    return u >= 0f && u <= 1f && v >= 0f && v <= 1f;
  }

  @Override
  public String toString() {
    return u + "," + v;
  }
}
