package ca.gc.cra.leap.domain.image;

import ca.gc.cra.leap.domain.Timestamp;
import java.util.Objects;

/**
 * <strong>What:</strong> Raw camera image together with its calibration map.
 * <p><strong>Why:</strong> Adapters copy image memory out of the service before releasing it, so the value stays
 * usable after the query returns.</p>
 * <p><strong>Thread-safety:</strong> Immutable; pixel and distortion buffers are defensively copied.</p>
 * <p><strong>Performance:</strong> One copy per buffer at construction; accessors hand out views or copies.</p>
 *
 * @since 0.1.0
 */
public final class Image {
  private final boolean valid;
  private final long sequenceId;
  private final Camera camera;
  private final Timestamp timestamp;
  private final int width;
  private final int height;
  private final int bytesPerPixel;
  private final byte[] pixels;
  private final float[] distortion;

  /**
   * Creates an image snapshot.
   *
   * @param valid whether the service marked the image valid
   * @param sequenceId sequence shared by the left and right image of one capture
   * @param camera camera that captured the image
   * @param timestamp capture time
   * @param width width in pixels
   * @param height height in pixels
   * @param bytesPerPixel bytes per pixel
   * @param pixels pixel bytes; copied, must hold {@code width * height * bytesPerPixel} bytes
   * @param distortion interleaved distortion map; copied
   */
  public Image(
      boolean valid,
      long sequenceId,
      Camera camera,
      Timestamp timestamp,
      int width,
      int height,
      int bytesPerPixel,
      byte[] pixels,
      float[] distortion) {
    if (width < 0 || height < 0 || bytesPerPixel < 0) {
      throw new IllegalArgumentException("image dimensions must not be negative");
    }
    long expected = (long) width * height * bytesPerPixel;
    byte[] copy = pixels == null ? new byte[0] : pixels.clone();
    if (copy.length != expected) {
      throw new IllegalArgumentException(
          "pixel buffer holds " + copy.length + " bytes, expected " + expected);
    }
    this.valid = valid;
    this.sequenceId = sequenceId;
    this.camera = Objects.requireNonNull(camera, "camera");
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    this.width = width;
    this.height = height;
    this.bytesPerPixel = bytesPerPixel;
    this.pixels = copy;
    this.distortion = distortion == null ? new float[0] : distortion.clone();
  }

  public boolean isValid() {
    return valid;
  }

  public long sequenceId() {
    return sequenceId;
  }

  public Camera camera() {
    return camera;
  }

  public Timestamp timestamp() {
    return timestamp;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int bytesPerPixel() {
    return bytesPerPixel;
  }

  /**
   * Returns a view over the pixel data.
   *
   * @return pixel view
   */
  public ImageData data() {
    return new ImageData(pixels, width * Math.max(1, bytesPerPixel));
  }

  /**
   * Returns a view over the calibration map.
   *
   * @return distortion view using the service's fixed row stride
   */
  public DistortionData distortion() {
    return new DistortionData(distortion, DistortionData.STRIDE);
  }

  @Override
  public String toString() {
    return "Image{"
        + "sequenceId=" + sequenceId
        + ", camera=" + camera
        + ", timestamp=" + timestamp
        + ", size=" + width + 'x' + height
        + ", valid=" + valid
        + '}';
  }
}
