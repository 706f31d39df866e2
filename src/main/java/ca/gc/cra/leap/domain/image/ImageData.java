package ca.gc.cra.leap.domain.image;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view over the pixel bytes of one camera image.
 *
 * <p>Pixels are stored row-major with one byte per pixel for the infrared cameras.</p>
 *
 * @since 0.1.0
 */
public final class ImageData {
  private final byte[] raw;
  private final int width;

  ImageData(byte[] raw, int width) {
    this.raw = Objects.requireNonNull(raw, "raw");
    if (width <= 0 && raw.length > 0) {
      throw new IllegalArgumentException("width must be positive");
    }
    this.width = width;
  }

  /**
   * Returns a copy of the raw pixel bytes.
   *
   * @return pixel bytes, row-major
   */
  public byte[] raw() {
    return raw.clone();
  }

  /**
   * Returns the number of pixel bytes.
   *
   * @return byte count
   */
  public int length() {
    return raw.length;
  }

  /**
   * Returns the unsigned pixel value at the given coordinates.
   *
   * @param x column
   * @param y row
   * @return brightness in {@code [0, 255]}
   * @throws IndexOutOfBoundsException if the coordinates fall outside the image
   */
  public int pixel(int x, int y) {
    if (x < 0 || x >= width) {
      throw new IndexOutOfBoundsException("x=" + x + " outside width " + width);
    }
    return Byte.toUnsignedInt(raw[Objects.checkIndex(y * width + x, raw.length)]);
  }

  /**
   * Splits the pixel bytes into rows.
   *
   * @return list of row copies; the last row may be short if the buffer is not a whole number of rows
   */
  public List<byte[]> rows() {
    List<byte[]> rows = new ArrayList<>();
    for (int off = 0; off < raw.length; off += width) {
      int len = Math.min(width, raw.length - off);
      byte[] row = new byte[len];
      System.arraycopy(raw, off, row, 0, len);
      rows.add(row);
    }
    return rows;
  }
}
